package com.purchasingpower.docflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocFlowApplication.class, args);
    }
}
