package ch.so.arp.lograg;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LogRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogRagApplication.class, args);
    }
}
