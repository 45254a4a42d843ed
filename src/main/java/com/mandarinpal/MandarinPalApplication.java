package com.mandarinpal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author MandarinPal
 * @since 2025-03-02
 */
@SpringBootApplication
public class MandarinPalApplication {

	public static void main(String[] args) {
		SpringApplication.run(MandarinPalApplication.class, args);
		System.out.println("===========================================================\n"+
		 "接口文档 UI (springdoc): " + "http://localhost:5050/swagger-ui.html\n"
		 + "===========================================================");

	}

}
