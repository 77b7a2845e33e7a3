package com.ewsmon.reference;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Runnable monitor: storage, probing engine and alerting wired into one process. */
@EnableScheduling
@Slf4j
@SpringBootApplication(scanBasePackages = {"com.ewsmon"})
public class EwsmonApplication {

    public static void main(String[] args) {
        log.info("Starting EWS monitor jvm={} cpus={}", Runtime.version(), Runtime.getRuntime().availableProcessors());
        SpringApplication.run(EwsmonApplication.class, args);
    }
}
