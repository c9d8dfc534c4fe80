package dev.jobscout;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Optional;

@Slf4j
@EnableScheduling
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class JobScoutApplication implements CommandLineRunner {

    private final PipelineRunner pipelineRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(JobScoutApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            Optional<RunTrigger> trigger = RunTrigger.fromArgs(args);
            if (trigger.isEmpty()) {
                log.info("No --run trigger given, serving scheduled runs only");
                return;
            }
            pipelineRunner.execute(trigger.get());
            log.info("Job Scout exiting...");
            exitManager.exit(0);
        } catch (Exception e) {
            log.error("Job Scout failed: {}", e.getMessage());
            exitManager.exit(1);
        }
    }
}
