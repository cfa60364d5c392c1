package com.zzf.miku;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MikuApplication {

    public static void main(String[] args) {
        SpringApplication.run(MikuApplication.class, args);
    }
}
