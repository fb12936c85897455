package com.sentimento.reference;

import com.sentimento.service.core.config.SentimentoProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

@Slf4j
@SpringBootApplication(scanBasePackages = {"com.sentimento"})
public class SentimentoApplication {

    public static void main(String[] args) {
        SpringApplication.run(SentimentoApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    void hubReady(ApplicationReadyEvent event) {
        SentimentoProperties properties = event.getApplicationContext().getBean(SentimentoProperties.class);
        log.info("Live hub ready {}", describe(properties));
    }

    static String describe(SentimentoProperties properties) {
        SentimentoProperties.Hub hub = properties.getHub();
        SentimentoProperties.Window window = properties.getWindow();
        SentimentoProperties.Access access = properties.getAccess();
        return "livePath=" + hub.getLivePath()
                + " maxConnections=" + hub.getMaxConnections()
                + " bufferMaxKb=" + hub.getBufferMaxKb()
                + " windowCapacity=" + window.getCapacity()
                + " recentCount=" + window.getRecentCount()
                + " seedbringers=" + access.getSeedbringerEmails().size()
                + " council=" + access.getCouncilEmails().size();
    }
}
