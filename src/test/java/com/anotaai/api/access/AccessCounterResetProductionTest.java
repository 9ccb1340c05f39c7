package com.anotaai.api.access;

import com.anotaai.api.access.service.AccessCounterService;
import com.anotaai.api.config.ExecutionMode;
import com.anotaai.api.testsupport.AsyncMvc;
import com.anotaai.api.testsupport.BaseSpringTest;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/** The mode is consulted per request: flipping it at runtime takes effect immediately. */
@SpringBootTest
@AutoConfigureMockMvc
class AccessCounterResetProductionTest extends BaseSpringTest {

    @Autowired MockMvc mvc;
    @Autowired AccessCounterService service;

    @MockitoBean ExecutionMode mode;

    @Test
    void reset_is_forbidden_in_production_and_leaves_counter_untouched() throws Exception {
        Mockito.when(mode.current()).thenReturn(ExecutionMode.TEST);
        service.reset();
        service.increment();
        service.increment();

        Mockito.when(mode.isProduction()).thenReturn(true);
        Mockito.when(mode.current()).thenReturn(ExecutionMode.PRODUCTION);

        AsyncMvc.perform(mvc, post("/api/access/reset"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Operation not allowed in production"));

        assertThat(service.currentCount().count()).isEqualTo(2L);

        Mockito.when(mode.isProduction()).thenReturn(false);

        AsyncMvc.perform(mvc, post("/api/access/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.count").value(0));
    }
}
