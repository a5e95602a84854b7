package io.procmon.console;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProcmonApplication {

    public static void main(String[] args) {
        // the console runner returns once the user quits; closing the context stops every monitor
        System.exit(SpringApplication.exit(SpringApplication.run(ProcmonApplication.class, args)));
    }
}
