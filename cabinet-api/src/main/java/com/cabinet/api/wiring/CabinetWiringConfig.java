package com.cabinet.api.wiring;

import com.cabinet.api.telegram.TelegramBotProperties;
import com.cabinet.application.ports.MessengerPort;
import com.cabinet.application.ports.PanelPort;
import com.cabinet.infrastructure.notification.NullMessenger;
import com.cabinet.infrastructure.notification.TelegramMessenger;
import com.cabinet.infrastructure.panel.OkHttpPanelClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class CabinetWiringConfig {

    private static final Logger log = LoggerFactory.getLogger(CabinetWiringConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(PanelPort.class)
    public PanelPort panelPort(PanelProperties props, ObjectMapper objectMapper) {
        var client = new OkHttpPanelClient(
            props.baseUrl(),
            props.apiToken(),
            Duration.ofSeconds(props.timeoutSecondsOrDefault()),
            objectMapper
        );
        if (!client.isConfigured()) {
            log.warn("VPN panel is not configured (cabinet.panel.base-url / api-token); panel calls will be refused");
        }
        return client;
    }

    @Bean
    @ConditionalOnMissingBean(MessengerPort.class)
    public MessengerPort messengerPort(TelegramBotProperties props, ObjectMapper objectMapper) {
        if (!props.hasToken()) {
            log.info("Telegram token is empty; outbound messages are logged only");
            return new NullMessenger();
        }
        return new TelegramMessenger(props.apiBaseUrlOrDefault(), props.token(), objectMapper);
    }

    /**
     * Independent transaction for side records (notifications) written after the main transition committed.
     */
    @Bean
    public TransactionTemplate requiresNewTransaction(PlatformTransactionManager txManager) {
        TransactionTemplate tt = new TransactionTemplate(txManager);
        tt.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return tt;
    }
}
