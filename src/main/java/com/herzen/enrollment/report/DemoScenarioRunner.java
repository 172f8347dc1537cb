package com.herzen.enrollment.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "enrollment.demo", name = "enabled", havingValue = "true")
public class DemoScenarioRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(DemoScenarioRunner.class);

    private final DemoScenario scenario;

    public DemoScenarioRunner(DemoScenario scenario) {
        this.scenario = scenario;
    }

    @Override
    public void run(String... args) {
        scenario.run().forEach(line -> log.info("[demo] {}", line));
    }
}
