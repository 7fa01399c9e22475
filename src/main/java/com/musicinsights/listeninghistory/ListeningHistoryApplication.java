package com.musicinsights.listeninghistory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * 청취 기록 업로드/동기화/집계 서비스의 엔트리 포인트.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ListeningHistoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(ListeningHistoryApplication.class, args);
    }
}
