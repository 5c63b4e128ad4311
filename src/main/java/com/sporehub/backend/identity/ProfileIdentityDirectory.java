package com.sporehub.backend.identity;

import com.sporehub.backend.auth.model.Identity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class ProfileIdentityDirectory implements IdentityDirectory {

    private final ProfileRepository profiles;

    @Override
    @Transactional(readOnly = true)
    public Optional<Identity> findByEmail(String email) {
        if (email == null || email.isBlank()) return Optional.empty();
        return profiles.findByEmailIgnoreCase(email.trim())
                .map(p -> new Identity(p.getId().toString(), p.getEmail(), p.getRole()));
    }
}
