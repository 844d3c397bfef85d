package com.example.sftpbroker;

import com.example.sftpbroker.service.ExpirySweeper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "app.session.max-sessions=12")
@AutoConfigureMockMvc
class SftpBrokerApplicationTest {

  @Autowired
  private ApplicationContext context;

  @Autowired
  private MockMvc mvc;

  @Test
  void streamsRunOnBoundedExecutorSeparateFromScheduler() {
    assertThat(context.containsBean("applicationTaskExecutor")).isTrue();
    ThreadPoolTaskExecutor executor = context.getBean("applicationTaskExecutor", ThreadPoolTaskExecutor.class);
    assertThat(executor.getMaxPoolSize()).isEqualTo(12);

    assertThat(context.getBean(TaskScheduler.class)).isNotSameAs(executor);
    assertThat(context.getBean(ExpirySweeper.class)).isNotNull();
  }

  @Test
  void openEndpointsCarryHardenedHeaders() throws Exception {
    mvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"))
        .andExpect(header().string("Permissions-Policy", containsString("camera=()")))
        .andExpect(header().string("X-Frame-Options", "DENY"))
        .andExpect(header().string("Cache-Control", containsString("no-store")));
  }

  @Test
  void protectedEndpointsNeedSession() throws Exception {
    mvc.perform(get("/api/files"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("invalid_session"));
  }

  @Test
  void unknownPathsAreDenied() throws Exception {
    mvc.perform(get("/internal/anything"))
        .andExpect(status().isForbidden());
  }
}
