package app.chatarchive;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatArchiveApplication {

	public static void main(String[] args) {
		SpringApplication.run(ChatArchiveApplication.class, args);
	}
}
