package ch.so.arp.pdfrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PdfRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(PdfRagApplication.class, args);
    }
}
