package com.di.fleetnova;

import com.di.fleetnova.runner.PipelineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@ConfigurationPropertiesScan
public class FleetNovaApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(FleetNovaApplication.class, args);
		// one pass per process; the context closes when the run is over
		try (ctx) {
			ctx.getBean(PipelineRunner.class).runFromArgs(args);
		}
	}
}
