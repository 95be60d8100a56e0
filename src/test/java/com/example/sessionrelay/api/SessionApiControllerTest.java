package com.example.sessionrelay.api;

import com.example.sessionrelay.persistence.UserSessionEntity;
import com.example.sessionrelay.service.SessionAuthService;
import com.example.sessionrelay.web.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SessionApiControllerTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withBean(SessionAuthService.class, () -> mock(SessionAuthService.class))
            .withUserConfiguration(SessionApiController.class);

    @Test
    void notMappedUnlessLocalLoginEnabled() {
        contextRunner.run(ctx -> assertThat(ctx).doesNotHaveBean(SessionApiController.class));
        contextRunner.withPropertyValues("relay.local-login-enabled=false")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(SessionApiController.class));
    }

    @Test
    void mappedWhenLocalLoginEnabled() {
        contextRunner.withPropertyValues("relay.local-login-enabled=true")
                .run(ctx -> assertThat(ctx).hasSingleBean(SessionApiController.class));
    }

    @Test
    void issuesTokenForUser() throws Exception {
        SessionAuthService auth = mock(SessionAuthService.class);
        when(auth.issue("u1")).thenReturn(new UserSessionEntity("LOCAL_SESSION_abc", "u1", 1_700_000_000_000L));
        MockMvc mvc = MockMvcBuilders.standaloneSetup(new SessionApiController(auth))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();

        mvc.perform(post("/api/v1/users/u1/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value("u1"))
                .andExpect(jsonPath("$.sessionToken").value("LOCAL_SESSION_abc"))
                .andExpect(jsonPath("$.expiresAt").value(1_700_000_000_000L));
    }
}
