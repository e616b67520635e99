package com.smurthy.ai.agri;

import com.smurthy.ai.agri.config.DispatchConfig;
import com.smurthy.ai.agri.config.HistoryStoreConfig;
import com.smurthy.ai.agri.config.WeatherConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({DispatchConfig.class, WeatherConfig.class, HistoryStoreConfig.class})
public class AgriAdvisorApplication {

	public static void main(String[] args) {
		SpringApplication.run(AgriAdvisorApplication.class, args);
	}

}
