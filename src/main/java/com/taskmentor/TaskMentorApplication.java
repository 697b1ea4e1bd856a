package com.taskmentor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TaskMentorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskMentorApplication.class, args);
    }
}
