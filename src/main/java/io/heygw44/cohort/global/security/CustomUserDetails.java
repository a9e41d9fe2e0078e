package io.heygw44.cohort.global.security;

import io.heygw44.cohort.domain.admin.entity.Admin;
import lombok.Getter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.io.Serial;
import java.util.Collection;
import java.util.List;

/**
 * 인증된 운영자 정보. 컨트롤러는 getAdminId()를 행위자 식별자로 서비스에 넘긴다.
 */
@Getter
public class CustomUserDetails implements UserDetails {

    @Serial
    private static final long serialVersionUID = 1L;

    private final Long adminId;
    private final String email;
    private final String passwordHash;
    private final String name;

    public CustomUserDetails(Admin admin) {
        this.adminId = admin.getId();
        this.email = admin.getEmail();
        this.passwordHash = admin.getPasswordHash();
        this.name = admin.getName();
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return List.of(new SimpleGrantedAuthority("ROLE_ADMIN"));
    }

    @Override
    public String getPassword() {
        return passwordHash;
    }

    @Override
    public String getUsername() {
        return email;
    }
}
