package mirror.email.app.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.authority.mapping.GrantedAuthoritiesMapper;
import org.springframework.security.oauth2.core.user.OAuth2UserAuthority;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Adds ROLE_ADMIN at login for the OAuth subjects listed in {@code mirror.security.admin-subjects}.
 * Works for both OIDC and plain OAuth2 logins, since {@code OidcUserAuthority} carries the id token claims.
 */
@Slf4j
@Component
public class AdminSubjectAuthoritiesMapper implements GrantedAuthoritiesMapper {
    static final String ADMIN_AUTHORITY = "ROLE_ADMIN";

    private final Set<String> adminSubjects;

    public AdminSubjectAuthoritiesMapper(MirrorProperties properties) {
        this.adminSubjects = Set.copyOf(properties.getSecurity().getAdminSubjects());
    }

    @Override
    public Collection<? extends GrantedAuthority> mapAuthorities(Collection<? extends GrantedAuthority> authorities) {
        Set<GrantedAuthority> mapped = new HashSet<>(authorities);
        for (GrantedAuthority authority : authorities) {
            if (authority instanceof OAuth2UserAuthority) {
                Object subject = ((OAuth2UserAuthority) authority).getAttributes().get("sub");
                if (subject != null && adminSubjects.contains(subject.toString())) {
                    log.info("Granting {} to subject {}", ADMIN_AUTHORITY, subject);
                    mapped.add(new SimpleGrantedAuthority(ADMIN_AUTHORITY));
                }
            }
        }
        return mapped;
    }
}
