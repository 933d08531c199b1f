package com.firefly.kbagent.security;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.Collection;
import java.util.List;

/**
 * 已认证的调用方身份。userId 取自身份令牌的 sub 声明，可能缺失。
 */
@Getter
@AllArgsConstructor
public class CustomUserPrincipal {

    private final String userId;
    private final String email;

    public Collection<? extends GrantedAuthority> getAuthorities() {
        return List.of(new SimpleGrantedAuthority("ROLE_USER"));
    }
}
