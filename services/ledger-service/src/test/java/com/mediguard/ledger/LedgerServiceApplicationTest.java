package com.mediguard.ledger;

import com.mediguard.ledger.anchor.AnchorService;
import com.mediguard.ledger.anchor.SimulatedAnchorService;
import com.mediguard.ledger.controller.LedgerController;
import com.mediguard.ledger.scheduler.AnchorCommitScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Ledger Service Application Tests")
class LedgerServiceApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    @Qualifier("anchorRestTemplate")
    private RestTemplate anchorRestTemplate;

    @Autowired
    private AnchorService anchorService;

    @Test
    @DisplayName("Should start the full context in simulated anchor mode")
    void shouldLoadContext() {
        assertThat(context.getBean(LedgerController.class)).isNotNull();
        assertThat(anchorService.mode()).isEqualTo(SimulatedAnchorService.MODE);
        assertThat(context.getBean(AnchorCommitScheduler.class).getState())
                .isEqualTo(AnchorCommitScheduler.State.STOPPED);
    }

    @Test
    @DisplayName("Should build the anchor RestTemplate with its metrics interceptor")
    void shouldConfigureAnchorRestTemplate() {
        assertThat(anchorRestTemplate.getInterceptors()).hasSize(1);
    }
}
