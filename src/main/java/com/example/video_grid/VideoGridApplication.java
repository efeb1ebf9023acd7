package com.example.video_grid;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VideoGridApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(VideoGridApplication.class, args)));
	}

}
