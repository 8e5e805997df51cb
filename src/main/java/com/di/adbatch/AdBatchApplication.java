package com.di.adbatch;

import com.di.adbatch.runner.BatchRunnerService;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AdBatchApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(AdBatchApplication.class, args);
		ApplicationArguments arguments = new DefaultApplicationArguments(args);
		int exitCode = ctx.getBean(BatchRunnerService.class).run(arguments);
		System.exit(SpringApplication.exit(ctx, () -> exitCode));
	}
}
