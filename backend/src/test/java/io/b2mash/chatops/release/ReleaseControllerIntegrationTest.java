package io.b2mash.chatops.release;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.chatops.TestcontainersConfiguration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class ReleaseControllerIntegrationTest {

  private static final String ORG_A = "1f0e2d3c-4b5a-4697-8877-665544332211";
  private static final String ORG_B = "aa11bb22-cc33-4d44-8e55-ff6677889900";

  @Autowired private MockMvc mockMvc;
  @Autowired private ProjectReleaseRepository releaseRepository;
  @Autowired private ReleaseAvailabilityCache releaseCache;

  @AfterEach
  void cleanUp() {
    releaseRepository.deleteAll();
  }

  @Test
  void admin_records_release_for_own_organization() throws Exception {
    mockMvc
        .perform(releaseRequest(ORG_A, 41L, "2.0.0").with(adminJwt(ORG_A)))
        .andExpect(status().isNoContent());

    assertThat(releaseCache.hasReleases(41L)).isTrue();
  }

  @Test
  void token_from_another_organization_is_rejected() throws Exception {
    mockMvc
        .perform(releaseRequest(ORG_A, 42L, "2.0.0").with(adminJwt(ORG_B)))
        .andExpect(status().isForbidden());

    assertThat(releaseRepository.existsByProjectId(42L)).isFalse();
  }

  @Test
  void project_owned_by_another_organization_is_rejected() throws Exception {
    mockMvc
        .perform(releaseRequest(ORG_A, 43L, "1.0.0").with(adminJwt(ORG_A)))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(releaseRequest(ORG_B, 43L, "1.0.1").with(adminJwt(ORG_B)))
        .andExpect(status().isForbidden());

    assertThat(releaseRepository.existsByProjectIdAndVersion(43L, "1.0.1")).isFalse();
  }

  @Test
  void member_cannot_record_release() throws Exception {
    mockMvc
        .perform(
            releaseRequest(ORG_A, 44L, "1.0.0")
                .with(
                    jwt()
                        .jwt(
                            j ->
                                j.subject("user_release_member")
                                    .claim("o", Map.of("id", ORG_A, "rol", "member")))
                        .authorities(List.of(new SimpleGrantedAuthority("ROLE_ORG_MEMBER")))))
        .andExpect(status().isForbidden());
  }

  private static MockHttpServletRequestBuilder releaseRequest(String orgId, long projectId, String version) {
    return post("/api/organizations/" + orgId + "/projects/" + projectId + "/releases")
        .contentType(MediaType.APPLICATION_JSON)
        .content("{\"version\": \"%s\"}".formatted(version));
  }

  private JwtRequestPostProcessor adminJwt(String orgId) {
    return jwt()
        .jwt(j -> j.subject("user_release_admin").claim("o", Map.of("id", orgId, "rol", "admin")))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_ORG_ADMIN")));
  }
}
