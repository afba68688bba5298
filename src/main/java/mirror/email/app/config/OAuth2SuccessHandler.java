package mirror.email.app.config;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import mirror.email.app.entity.User;
import mirror.email.app.service.CredentialService;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClient;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClientService;
import org.springframework.security.oauth2.client.authentication.OAuth2AuthenticationToken;
import org.springframework.security.oauth2.core.OAuth2AccessToken;
import org.springframework.security.web.authentication.SimpleUrlAuthenticationSuccessHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Persists the Google grant at login so background sync can act without the user present.
 */
@Slf4j
@Component
public class OAuth2SuccessHandler extends SimpleUrlAuthenticationSuccessHandler {
    private final OAuth2AuthorizedClientService authorizedClientService;
    private final CredentialService credentialService;

    public OAuth2SuccessHandler(
            OAuth2AuthorizedClientService authorizedClientService,
            CredentialService credentialService) {
        this.authorizedClientService = authorizedClientService;
        this.credentialService = credentialService;
        setDefaultTargetUrl("/api/mailbox/credential");
    }

    @Override
    public void onAuthenticationSuccess(HttpServletRequest request, HttpServletResponse response,
                                        Authentication authentication) throws IOException, ServletException {
        if (authentication instanceof OAuth2AuthenticationToken) {
            OAuth2AuthenticationToken oauthToken = (OAuth2AuthenticationToken) authentication;
            OAuth2AuthorizedClient client = authorizedClientService.loadAuthorizedClient(
                oauthToken.getAuthorizedClientRegistrationId(),
                oauthToken.getName()
            );

            if (client != null) {
                User user = credentialService.getOrCreateUser(authentication);
                OAuth2AccessToken accessToken = client.getAccessToken();
                String scopes = accessToken.getScopes() != null ? String.join(" ", accessToken.getScopes()) : "";
                String refreshToken = client.getRefreshToken() != null ? client.getRefreshToken().getTokenValue() : null;
                credentialService.storeAuthorizationGrant(user, accessToken.getTokenValue(), refreshToken,
                    accessToken.getExpiresAt(), scopes);
            } else {
                log.warn("No authorized client found for {} after login", oauthToken.getName());
            }
        }

        super.onAuthenticationSuccess(request, response, authentication);
    }
}
