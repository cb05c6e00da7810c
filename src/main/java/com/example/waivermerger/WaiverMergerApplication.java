package com.example.waivermerger;

import com.example.waivermerger.interfaces.cli.MergeCommandLineRunner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Application entry point for the waiver merger.
 * Serves the HTTP API by default; with {@code waiver.cli.enabled=true} it runs the merge command once
 * and exits with the command's exit code.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class WaiverMergerApplication {

	/**
	 * Boots the Spring container.
	 *
	 * @param args command line arguments; in CLI mode the positional ones are the merge inputs
	 */
	public static void main(String[] args) {
		ConfigurableApplicationContext context = SpringApplication.run(WaiverMergerApplication.class, args);
		if (!context.getBeansOfType(MergeCommandLineRunner.class).isEmpty()) {
			System.exit(SpringApplication.exit(context));
		}
	}

}
