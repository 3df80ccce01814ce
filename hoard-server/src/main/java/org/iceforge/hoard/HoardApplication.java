package org.iceforge.hoard;

import org.iceforge.hoard.config.HoardProperties;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

/**
 * Runs the HTTP server, or a single command when one is given:
 * {@code hoard <command> [json-request]}.
 */
@SpringBootApplication
@EnableConfigurationProperties(HoardProperties.class)
public class HoardApplication {

	public static void main(String[] args) {
		if (hasCommand(args)) {
			ConfigurableApplicationContext ctx = new SpringApplicationBuilder(HoardApplication.class)
					.web(WebApplicationType.NONE)
					.bannerMode(Banner.Mode.OFF)
					.logStartupInfo(false)
					.run(args);
			System.exit(SpringApplication.exit(ctx));
		} else {
			SpringApplication.run(HoardApplication.class, args);
		}
	}

	static boolean hasCommand(String[] args) {
		return Arrays.stream(args).anyMatch(a -> !a.startsWith("--"));
	}
}
