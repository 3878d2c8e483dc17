package com.example.admission;

import com.example.admission.cli.OperatorCommands;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AdmissionApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(AdmissionApplication.class);
        if (!OperatorCommands.isOperatorCommand(args)) {
            application.run(args);
            return;
        }
        // operator commands run once in a non-web context and exit with the command's code
        application.setWebApplicationType(WebApplicationType.NONE);
        application.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(application.run(args)));
    }
}
