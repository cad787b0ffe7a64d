package dev.reviewgate.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.authentication.ProviderManager;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.preauth.AbstractPreAuthenticatedProcessingFilter;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationProvider;
import org.springframework.security.web.authentication.preauth.RequestHeaderAuthenticationFilter;
import org.springframework.security.web.context.RequestAttributeSecurityContextRepository;

import java.util.List;

/**
 * Stateless security. Tokens are verified upstream (gateway); the already-resolved
 * caller identity arrives in a request header and becomes the principal name.
 * CSRF disabled (API consumed by services, not browsers).
 */
@Configuration
public class SecurityConfig {

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http,
            @Value("${reviewgate.security.identity-header:X-Caller-Identity}") String identityHeader) throws Exception {
        PreAuthenticatedAuthenticationProvider provider = new PreAuthenticatedAuthenticationProvider();
        provider.setPreAuthenticatedUserDetailsService(token ->
                new User(token.getName(), "", List.of()));

        RequestHeaderAuthenticationFilter identityFilter = new RequestHeaderAuthenticationFilter();
        identityFilter.setPrincipalRequestHeader(identityHeader);
        identityFilter.setExceptionIfHeaderMissing(false);
        identityFilter.setAuthenticationManager(new ProviderManager(provider));
        identityFilter.setSecurityContextRepository(new RequestAttributeSecurityContextRepository());

        http
            .csrf(AbstractHttpConfigurer::disable)
            .sessionManagement(s -> s.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .addFilterAt(identityFilter, AbstractPreAuthenticatedProcessingFilter.class)
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/health/**", "/actuator/info").permitAll()
                .anyRequest().authenticated()
            );
        return http.build();
    }
}
