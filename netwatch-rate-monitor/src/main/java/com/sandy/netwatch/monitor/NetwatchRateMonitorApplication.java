package com.sandy.netwatch.monitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class NetwatchRateMonitorApplication {

	public static void main(String[] args) {
		SpringApplication.run(NetwatchRateMonitorApplication.class, args);
	}

}
