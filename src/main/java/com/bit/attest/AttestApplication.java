package com.bit.attest;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.attest")
public class AttestApplication {
    public static void main(String[] args) {
        SpringApplication.run(AttestApplication.class, args);
    }
    //二进制统一大端
}
