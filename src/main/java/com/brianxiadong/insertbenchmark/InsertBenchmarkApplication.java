package com.brianxiadong.insertbenchmark;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * InsertBenchmark 应用程序的主入口类
 * 
 * @author Brian Xia
 */
@SpringBootApplication
public class InsertBenchmarkApplication {

    public static void main(String[] args) {
        SpringApplication.run(InsertBenchmarkApplication.class, args);
    }

}
