package com.codeheadsystems.kastell.server.session;

/**
 * One node of the session tree: a {@link UserSession}, a {@link ClientSession} or a
 * {@link Grant}. The depth of its {@link SessionKey} decides which.
 */
public interface SessionRecord {
}
