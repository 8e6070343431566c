package com.example.awardcertificates;

import com.example.awardcertificates.config.CertificateProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "Award Certificates API",
                version = "1.0",
                description = "REST API for uploading competition award certificates, reviewing the recognized fields "
                        + "and submitting them before the deadline.",
                contact = @Contact(name = "Award Certificates")))
@SpringBootApplication
@EnableConfigurationProperties(CertificateProperties.class)
public class AwardCertificatesApplication {

    public static void main(String[] args) {
        SpringApplication.run(AwardCertificatesApplication.class, args);
    }
}
