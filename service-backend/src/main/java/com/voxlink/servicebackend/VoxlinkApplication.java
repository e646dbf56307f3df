package com.voxlink.servicebackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VoxlinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoxlinkApplication.class, args);
    }
}
