package com.pingponghub.practice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class PracticeSchedulerApplication {

	private static final Logger logger = LoggerFactory.getLogger(PracticeSchedulerApplication.class);

	public static void main(String[] args) {
		SpringApplication app = new SpringApplication(PracticeSchedulerApplication.class);
		app.run(args);
	}
	
	@EventListener(WebServerInitializedEvent.class)
	public void onWebServerReady(WebServerInitializedEvent event) {
		logger.info("Practice scheduler listening on port {}", event.getWebServer().getPort());
	}

}
