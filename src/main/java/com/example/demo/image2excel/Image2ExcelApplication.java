package com.example.demo.image2excel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Image2ExcelApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(Image2ExcelApplication.class, args)));
	}

}
