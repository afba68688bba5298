package mirror.email.app.config;

import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.oauth2.client.web.OAuth2AuthorizationRequestResolver;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationRequest;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OfflineAccessAuthorizationRequestResolverTest {

    @Mock
    private OAuth2AuthorizationRequestResolver delegate;

    @Mock
    private HttpServletRequest request;

    @Test
    void resolve_WithGoogleRequest_ShouldAskForOfflineAccessAndConsent() {
        // Given
        OAuth2AuthorizationRequest original = OAuth2AuthorizationRequest.authorizationCode()
            .authorizationUri("https://accounts.google.com/o/oauth2/v2/auth")
            .clientId("test-client-id")
            .redirectUri("http://localhost/login/oauth2/code/google")
            .state("state-1")
            .additionalParameters(Map.of("include_granted_scopes", "true"))
            .build();
        when(delegate.resolve(request, "google")).thenReturn(original);
        OfflineAccessAuthorizationRequestResolver resolver = new OfflineAccessAuthorizationRequestResolver(delegate);

        // When
        OAuth2AuthorizationRequest resolved = resolver.resolve(request, "google");

        // Then
        assertEquals("offline", resolved.getAdditionalParameters().get("access_type"));
        assertEquals("consent", resolved.getAdditionalParameters().get("prompt"));
        assertEquals("true", resolved.getAdditionalParameters().get("include_granted_scopes"));
        assertEquals("state-1", resolved.getState());
        assertTrue(resolved.getAuthorizationRequestUri().contains("access_type=offline"));
        assertTrue(resolved.getAuthorizationRequestUri().contains("prompt=consent"));
    }

    @Test
    void resolve_WhenNotAnAuthorizationRequest_ShouldReturnNull() {
        // Given
        when(delegate.resolve(request)).thenReturn(null);

        // When & Then
        assertNull(new OfflineAccessAuthorizationRequestResolver(delegate).resolve(request));
    }
}
