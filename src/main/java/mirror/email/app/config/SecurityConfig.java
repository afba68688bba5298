package mirror.email.app.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.oauth2.client.registration.ClientRegistrationRepository;
import org.springframework.security.oauth2.client.web.DefaultOAuth2AuthorizationRequestResolver;
import org.springframework.security.oauth2.client.web.OAuth2AuthorizationRequestResolver;
import org.springframework.security.web.SecurityFilterChain;

@Configuration
public class SecurityConfig {
    private final OAuth2SuccessHandler oauth2SuccessHandler;
    private final ClientRegistrationRepository clientRegistrationRepository;
    private final AdminSubjectAuthoritiesMapper adminSubjectAuthoritiesMapper;

    public SecurityConfig(OAuth2SuccessHandler oauth2SuccessHandler,
                          ClientRegistrationRepository clientRegistrationRepository,
                          AdminSubjectAuthoritiesMapper adminSubjectAuthoritiesMapper) {
        this.oauth2SuccessHandler = oauth2SuccessHandler;
        this.clientRegistrationRepository = clientRegistrationRepository;
        this.adminSubjectAuthoritiesMapper = adminSubjectAuthoritiesMapper;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .authorizeHttpRequests(authorize -> authorize
                        .requestMatchers("/", "/login", "/error").permitAll()
                        // Syncing someone else's mailbox is an operator action
                        .requestMatchers("/api/mailbox/sync/*").hasRole("ADMIN")
                        .anyRequest().authenticated()
                )
                // JSON API authenticated by session cookie from the OAuth login
                .csrf(csrf -> csrf.ignoringRequestMatchers("/api/**"))
                .oauth2Login(oauth2 -> oauth2
                        .successHandler(oauth2SuccessHandler)
                        .failureUrl("/login?error=true")
                        .authorizationEndpoint(authorization -> authorization
                                .authorizationRequestResolver(offlineAccessAuthorizationRequestResolver())
                        )
                        .userInfoEndpoint(userInfo -> userInfo
                                .userAuthoritiesMapper(adminSubjectAuthoritiesMapper)
                        )
                )
                .logout(logout -> logout
                        .logoutUrl("/logout")
                        .logoutSuccessUrl("/login?logout=true")
                        .invalidateHttpSession(true)
                        .clearAuthentication(true)
                        .permitAll()
                );

        return http.build();
    }

    @Bean
    public OAuth2AuthorizationRequestResolver offlineAccessAuthorizationRequestResolver() {
        DefaultOAuth2AuthorizationRequestResolver defaultResolver =
            new DefaultOAuth2AuthorizationRequestResolver(clientRegistrationRepository, "/oauth2/authorization");
        return new OfflineAccessAuthorizationRequestResolver(defaultResolver);
    }
}
