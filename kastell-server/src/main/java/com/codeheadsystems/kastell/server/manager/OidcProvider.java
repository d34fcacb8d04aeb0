package com.codeheadsystems.kastell.server.manager;

import com.codeheadsystems.kastell.server.authn.AuthenticationBroker;
import com.codeheadsystems.kastell.server.authn.AuthenticationMethodRegistry;
import com.codeheadsystems.kastell.server.authn.MethodEnvironment;
import com.codeheadsystems.kastell.server.authorization.AuthorizationFlow;
import com.codeheadsystems.kastell.server.authorization.AuthorizationRequestParser;
import com.codeheadsystems.kastell.server.authorization.GrantAuthorizer;
import com.codeheadsystems.kastell.server.authorization.ReauthenticationPolicy;
import com.codeheadsystems.kastell.server.authorization.RedirectUriValidator;
import com.codeheadsystems.kastell.server.authorization.RequestObjectResolver;
import com.codeheadsystems.kastell.server.authorization.ResponseBuilder;
import com.codeheadsystems.kastell.server.authorization.ScopePolicy;
import com.codeheadsystems.kastell.server.authorization.SessionStateCalculator;
import com.codeheadsystems.kastell.server.claims.ClaimsResolver;
import com.codeheadsystems.kastell.server.claims.InMemoryUserInfoSource;
import com.codeheadsystems.kastell.server.claims.ScopeClaims;
import com.codeheadsystems.kastell.server.claims.UserInfoSource;
import com.codeheadsystems.kastell.server.client.ClientRegistry;
import com.codeheadsystems.kastell.server.client.InMemoryClientRegistry;
import com.codeheadsystems.kastell.server.config.ProviderContext;
import com.codeheadsystems.kastell.server.config.ProviderSettings;
import com.codeheadsystems.kastell.server.cookie.CookieDealer;
import com.codeheadsystems.kastell.server.cookie.HmacCookieDealer;
import com.codeheadsystems.kastell.server.endpoint.ClientAuthenticator;
import com.codeheadsystems.kastell.server.endpoint.IntrospectionEndpoint;
import com.codeheadsystems.kastell.server.endpoint.TokenEndpoint;
import com.codeheadsystems.kastell.server.endpoint.UserInfoEndpoint;
import com.codeheadsystems.kastell.server.logout.BackChannelNotifier;
import com.codeheadsystems.kastell.server.logout.EndSessionManager;
import com.codeheadsystems.kastell.server.logout.HttpBackChannelNotifier;
import com.codeheadsystems.kastell.server.logout.LogoutCoordinator;
import com.codeheadsystems.kastell.server.par.PushedAuthorizationService;
import com.codeheadsystems.kastell.server.session.SessionManager;
import com.codeheadsystems.kastell.server.session.SubjectIdentifiers;
import com.codeheadsystems.kastell.server.session.TokenEngine;
import com.codeheadsystems.kastell.server.session.TokenType;
import com.codeheadsystems.kastell.server.store.InMemoryPushedAuthorizationStore;
import com.codeheadsystems.kastell.server.store.InMemorySessionStore;
import com.codeheadsystems.kastell.server.store.PushedAuthorizationStore;
import com.codeheadsystems.kastell.server.store.SessionStore;
import com.codeheadsystems.kastell.server.token.Hashing;
import com.codeheadsystems.kastell.server.token.IdTokenCodec;
import com.codeheadsystems.kastell.server.token.IdTokenFactory;
import com.codeheadsystems.kastell.server.token.JwtTokenCodec;
import com.codeheadsystems.kastell.server.token.KeyMaterial;
import com.codeheadsystems.kastell.server.token.SidCipher;
import com.codeheadsystems.kastell.server.token.TokenCodec;
import com.codeheadsystems.kastell.server.token.TokenHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.net.http.HttpClient;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The assembled provider: every protocol component, wired once from settings and
 * collaborators.
 * <p>
 * Collaborators left unset fall back to development defaults (in-memory stores, random keys,
 * a fixed-user authentication method), each of which logs a warning.
 * <pre>{@code
 *   OidcProvider provider = OidcProvider.builder(settings)
 *       .clients(clientRegistry)
 *       .keyMaterial(keys)
 *       .authenticationMethods(List.of(new MethodConfig("pw", "password", acr, Map.of())))
 *       .build();
 * }</pre>
 */
public class OidcProvider {

  private static final Logger log = LoggerFactory.getLogger(OidcProvider.class);

  private final ProviderContext context;
  private final AuthenticationBroker broker;
  private final AuthorizationRequestParser parser;
  private final AuthorizationFlow authorizationFlow;
  private final ClientAuthenticator clientAuthenticator;
  private final TokenEngine tokenEngine;
  private final TokenEndpoint tokenEndpoint;
  private final UserInfoEndpoint userInfoEndpoint;
  private final IntrospectionEndpoint introspectionEndpoint;
  private final PushedAuthorizationService pushedAuthorizationService;
  private final ClaimsResolver claimsResolver;
  private final LogoutCoordinator logoutCoordinator;
  private final EndSessionManager endSessionManager;
  private final ScopeClaims scopeClaims;

  private OidcProvider(Builder b) {
    ProviderSettings settings = b.settings;
    Clock clock = b.clock;
    ObjectMapper mapper = b.objectMapper;
    KeyMaterial keys = b.keyMaterial;
    ClientRegistry clients = b.clients;

    SidCipher sidCipher = new SidCipher(keys.sidSecret());
    JwtTokenCodec jwtCodec = new JwtTokenCodec(keys.tokenSecret(), settings.issuer(), clock);
    IdTokenCodec idTokenCodec = new IdTokenCodec(keys, clients, sidCipher, settings.issuer(),
        settings.idTokenSigningAlg(), clock);
    Map<TokenType, TokenCodec> codecs = new EnumMap<>(TokenType.class);
    codecs.put(TokenType.AUTHORIZATION_CODE, jwtCodec);
    codecs.put(TokenType.ACCESS_TOKEN, jwtCodec);
    codecs.put(TokenType.REFRESH_TOKEN, jwtCodec);
    codecs.put(TokenType.ID_TOKEN, idTokenCodec);
    TokenHandler tokenHandler = new TokenHandler(codecs);

    String subjectSalt = b.subjectSalt != null
        ? b.subjectSalt : HexFormat.of().formatHex(Hashing.sha256(keys.sidSecret()));
    SessionManager sessionManager = new SessionManager(b.sessionStore, tokenHandler,
        new SubjectIdentifiers(subjectSalt), settings.usageRules(), clock);
    CookieDealer cookieDealer = b.cookieDealer != null
        ? b.cookieDealer : new HmacCookieDealer(keys.cookieSecret(), clock, "Lax", b.secureCookies);
    this.context = new ProviderContext(settings, sessionManager, clients, keys, cookieDealer,
        mapper, clock);

    this.broker = b.registry.buildBroker(b.methods,
        new MethodEnvironment(cookieDealer, settings.sessionCookieName(), mapper, clock));
    this.parser = new AuthorizationRequestParser(mapper);
    ScopePolicy scopePolicy = new ScopePolicy(clients, settings.scopesSupported(),
        settings.denyUnknownScopes());
    this.scopeClaims = new ScopeClaims(settings.customScopes());
    this.claimsResolver = new ClaimsResolver(sessionManager, clients, scopePolicy, scopeClaims,
        settings, b.userInfoSource);
    this.tokenEngine = new TokenEngine(sessionManager);
    IdTokenFactory idTokenFactory = new IdTokenFactory(sessionManager, tokenEngine,
        claimsResolver, idTokenCodec);
    RedirectUriValidator redirectUriValidator = new RedirectUriValidator(clients);
    RequestObjectResolver requestObjectResolver = new RequestObjectResolver(clients,
        b.pushedAuthorizationStore, parser, settings, b.httpClient, mapper, clock);

    this.authorizationFlow = new AuthorizationFlow(context, broker, b.reauthenticationPolicy,
        redirectUriValidator, scopePolicy, requestObjectResolver, parser,
        new GrantAuthorizer(sessionManager, clients, scopePolicy, claimsResolver, settings),
        tokenEngine, idTokenFactory, new ResponseBuilder(),
        new SessionStateCalculator(cookieDealer, settings.sessionManagementCookieName(), mapper));
    this.clientAuthenticator = new ClientAuthenticator(clients);
    this.tokenEndpoint = new TokenEndpoint(sessionManager, tokenEngine, idTokenFactory);
    this.userInfoEndpoint = new UserInfoEndpoint(sessionManager, claimsResolver);
    this.introspectionEndpoint = new IntrospectionEndpoint(sessionManager, settings.issuer());
    this.pushedAuthorizationService = new PushedAuthorizationService(b.pushedAuthorizationStore,
        parser, requestObjectResolver, redirectUriValidator, settings, clock);

    BackChannelNotifier notifier = b.backChannelNotifier != null
        ? b.backChannelNotifier : new HttpBackChannelNotifier(b.httpClient, settings.remoteTimeout());
    this.logoutCoordinator = new LogoutCoordinator(sessionManager, clients, settings, keys,
        idTokenCodec, sidCipher, notifier, clock);
    this.endSessionManager = new EndSessionManager(sessionManager, settings, cookieDealer, mapper,
        keys, idTokenCodec, redirectUriValidator, logoutCoordinator, clock);
    log.info("OpenID Provider {} ready with {} authentication method(s)", settings.issuer(),
        broker.registrations().size());
  }

  public static Builder builder(ProviderSettings settings) {
    return new Builder(settings);
  }

  public ProviderContext context() {
    return context;
  }

  public ProviderSettings settings() {
    return context.settings();
  }

  public SessionManager sessionManager() {
    return context.sessionManager();
  }

  public AuthenticationBroker broker() {
    return broker;
  }

  public AuthorizationRequestParser parser() {
    return parser;
  }

  public AuthorizationFlow authorizationFlow() {
    return authorizationFlow;
  }

  public ClientAuthenticator clientAuthenticator() {
    return clientAuthenticator;
  }

  public TokenEngine tokenEngine() {
    return tokenEngine;
  }

  public TokenEndpoint tokenEndpoint() {
    return tokenEndpoint;
  }

  public UserInfoEndpoint userInfoEndpoint() {
    return userInfoEndpoint;
  }

  public IntrospectionEndpoint introspectionEndpoint() {
    return introspectionEndpoint;
  }

  public PushedAuthorizationService pushedAuthorizationService() {
    return pushedAuthorizationService;
  }

  public ClaimsResolver claimsResolver() {
    return claimsResolver;
  }

  public ScopeClaims scopeClaims() {
    return scopeClaims;
  }

  public LogoutCoordinator logoutCoordinator() {
    return logoutCoordinator;
  }

  public EndSessionManager endSessionManager() {
    return endSessionManager;
  }

  /**
   * Builder for {@link OidcProvider}.
   */
  public static class Builder {
    private final ProviderSettings settings;
    private ClientRegistry clients;
    private KeyMaterial keyMaterial;
    private SessionStore sessionStore;
    private PushedAuthorizationStore pushedAuthorizationStore;
    private UserInfoSource userInfoSource;
    private CookieDealer cookieDealer;
    private boolean secureCookies = true;
    private AuthenticationMethodRegistry registry = AuthenticationMethodRegistry.standard();
    private List<AuthenticationMethodRegistry.MethodConfig> methods;
    private ReauthenticationPolicy reauthenticationPolicy = ReauthenticationPolicy.NEVER;
    private HttpClient httpClient;
    private BackChannelNotifier backChannelNotifier;
    private String subjectSalt;
    private Clock clock = Clock.systemUTC();
    private ObjectMapper objectMapper;

    private Builder(ProviderSettings settings) {
      this.settings = settings;
    }

    public Builder clients(ClientRegistry clients) {
      this.clients = clients;
      return this;
    }

    public Builder keyMaterial(KeyMaterial keyMaterial) {
      this.keyMaterial = keyMaterial;
      return this;
    }

    public Builder sessionStore(SessionStore sessionStore) {
      this.sessionStore = sessionStore;
      return this;
    }

    public Builder pushedAuthorizationStore(PushedAuthorizationStore store) {
      this.pushedAuthorizationStore = store;
      return this;
    }

    public Builder userInfoSource(UserInfoSource userInfoSource) {
      this.userInfoSource = userInfoSource;
      return this;
    }

    public Builder cookieDealer(CookieDealer cookieDealer) {
      this.cookieDealer = cookieDealer;
      return this;
    }

    public Builder secureCookies(boolean secureCookies) {
      this.secureCookies = secureCookies;
      return this;
    }

    public Builder authenticationMethodRegistry(AuthenticationMethodRegistry registry) {
      this.registry = registry;
      return this;
    }

    public Builder authenticationMethods(List<AuthenticationMethodRegistry.MethodConfig> methods) {
      this.methods = methods;
      return this;
    }

    public Builder reauthenticationPolicy(ReauthenticationPolicy policy) {
      this.reauthenticationPolicy = policy;
      return this;
    }

    public Builder httpClient(HttpClient httpClient) {
      this.httpClient = httpClient;
      return this;
    }

    public Builder backChannelNotifier(BackChannelNotifier notifier) {
      this.backChannelNotifier = notifier;
      return this;
    }

    public Builder subjectSalt(String subjectSalt) {
      this.subjectSalt = subjectSalt;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }

    public OidcProvider build() {
      if (clients == null) {
        clients = new InMemoryClientRegistry();
      }
      if (keyMaterial == null) {
        log.warn("No key material configured: generating random keys. "
            + "Tokens and cookies will be invalidated on restart. Do not use in production.");
        keyMaterial = KeyMaterial.generate(new SecureRandom());
      }
      if (sessionStore == null) {
        sessionStore = new InMemorySessionStore();
      }
      if (pushedAuthorizationStore == null) {
        pushedAuthorizationStore = new InMemoryPushedAuthorizationStore(clock);
      }
      if (userInfoSource == null) {
        userInfoSource = new InMemoryUserInfoSource();
      }
      if (methods == null || methods.isEmpty()) {
        log.warn("No authentication method configured: every login succeeds as 'diana'. "
            + "Do not use in production.");
        methods = List.of(new AuthenticationMethodRegistry.MethodConfig("anon",
            AuthenticationMethodRegistry.NO_AUTHN,
            "urn:oasis:names:tc:SAML:2.0:ac:classes:InternetProtocolPassword",
            Map.of("user", "diana")));
      }
      if (httpClient == null) {
        httpClient = HttpClient.newBuilder()
            .connectTimeout(settings.remoteTimeout())
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
      }
      if (objectMapper == null) {
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
      }
      return new OidcProvider(this);
    }
  }
}
