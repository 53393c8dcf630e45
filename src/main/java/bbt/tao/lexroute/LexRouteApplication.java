package bbt.tao.lexroute;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LexRouteApplication {

    public static void main(String[] args) {
        SpringApplication.run(LexRouteApplication.class, args);
    }

}
