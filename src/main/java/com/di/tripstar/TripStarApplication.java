package com.di.tripstar;

import com.di.tripstar.config.TripStarProperties;
import com.di.tripstar.pipeline.RunStatus;
import com.di.tripstar.pipeline.TripStarPipeline;
import com.di.tripstar.pipeline.dto.PipelineRunResponse;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

@SpringBootApplication
@EnableAspectJAutoProxy
@EnableConfigurationProperties(TripStarProperties.class)
public class TripStarApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext ctx = SpringApplication.run(TripStarApplication.class, args);
        TripStarProperties.Pipeline pipelineProps = ctx.getBean(TripStarProperties.class).getPipeline();

        // Container invoked by the orchestrator: run once, optionally exit with the run's outcome.
        if (pipelineProps.isRunOnStartup()) {
            PipelineRunResponse response = ctx.getBean(TripStarPipeline.class).run(null);
            if (pipelineProps.isExitAfterRun()) {
                int exitCode = RunStatus.SUCCEEDED.name().equals(response.getStatus()) ? 0 : 1;
                System.exit(SpringApplication.exit(ctx, () -> exitCode));
            }
        }
    }
}
