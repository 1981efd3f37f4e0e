package ir.ramtung.canonicalorders;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.jms.annotation.EnableJms;

@SpringBootApplication
@EnableJms
public class CanonicalOrdersApplication {

	public static void main(String[] args) {
		SpringApplication.run(CanonicalOrdersApplication.class, args);
	}
}
