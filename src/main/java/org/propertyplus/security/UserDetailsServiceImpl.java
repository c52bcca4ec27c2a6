package org.propertyplus.security;

import org.propertyplus.model.Account;
import org.propertyplus.repo.AccountRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

@Service
public class UserDetailsServiceImpl implements UserDetailsService {

    @Autowired
    private AccountRepository accountRepo;

    // username = e-mail du compte (sujet du jeton)
    @Override
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        Account a = accountRepo.findByEmailIgnoreCase(username)
                .orElseThrow(() -> new UsernameNotFoundException("Account not found"));

        String role = (a.getRole() != null && !a.getRole().isBlank()) ? a.getRole().toUpperCase() : "BUYER";
        return User.withUsername(a.getEmail())
                .password(a.getPasswordHash())
                .roles(role)
                .build();
    }
}
