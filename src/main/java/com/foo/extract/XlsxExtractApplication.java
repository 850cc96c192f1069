package com.foo.extract;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class XlsxExtractApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(XlsxExtractApplication.class, args)));
    }
}
