package com.sporehub.backend.identity;

import com.sporehub.backend.auth.model.Identity;
import com.sporehub.backend.auth.model.Role;
import com.sporehub.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(ProfileIdentityDirectory.class)
class ProfileIdentityDirectoryTest extends BaseSpringTest {

    @Autowired ProfileRepository profiles;
    @Autowired IdentityDirectory directory;

    @Test
    void finds_profile_case_insensitively() {
        Profile p = new Profile();
        p.setFullName("Otieno Ouma");
        p.setEmail(" Otieno@Market.co.ke ");
        p.setPassword("$2a$10$hash");
        p.setRole(Role.BUYER);
        Profile saved = profiles.saveAndFlush(p);

        Optional<Identity> found = directory.findByEmail("OTIENO@market.co.ke");

        assertThat(found).contains(new Identity(saved.getId().toString(), "otieno@market.co.ke", Role.BUYER));
        assertThat(saved.getCreatedAt()).isNotNull();
    }

    @Test
    void unknown_or_blank_email_is_empty() {
        assertThat(directory.findByEmail("ghost@example.com")).isEmpty();
        assertThat(directory.findByEmail("  ")).isEmpty();
    }
}
