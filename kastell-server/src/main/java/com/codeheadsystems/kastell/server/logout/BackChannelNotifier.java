package com.codeheadsystems.kastell.server.logout;

/**
 * Delivers back-channel logout tokens to relying parties.
 * <p>
 * Implementations must not throw on delivery failure; one unreachable client never blocks
 * the notification of the others.
 */
public interface BackChannelNotifier {

  /**
   * Delivers one notification.
   *
   * @param clientId     the client being notified
   * @param notification where and what to deliver
   * @return true if the client acknowledged the logout or answered with a tolerated status
   */
  boolean deliver(String clientId, BackChannelLogout notification);
}
