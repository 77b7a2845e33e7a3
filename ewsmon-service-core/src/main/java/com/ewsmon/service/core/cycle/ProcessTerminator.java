package com.ewsmon.service.core.cycle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/** Closes the application context and exits the JVM with the given code. */
@Component
@Slf4j
@RequiredArgsConstructor
public class ProcessTerminator {

    private final ConfigurableApplicationContext context;

    public void terminate(int exitCode) {
        log.error("Terminating monitor exitCode={}", exitCode);
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }
}
