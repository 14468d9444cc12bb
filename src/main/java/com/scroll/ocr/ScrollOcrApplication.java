package com.scroll.ocr;

import com.scroll.ocr.cli.ScreenshotOcrCommand;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import picocli.CommandLine;

@SpringBootApplication
public class ScrollOcrApplication implements CommandLineRunner, ExitCodeGenerator {

    private final ObjectProvider<ScreenshotOcrCommand> commandProvider;

    private int exitCode;

    public ScrollOcrApplication(ObjectProvider<ScreenshotOcrCommand> commandProvider) {
        this.commandProvider = commandProvider;
    }

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ScrollOcrApplication.class, args)));
    }

    @Override
    public void run(String... args) {
        CommandLine commandLine = ScreenshotOcrCommand.configure(new CommandLine(commandProvider.getObject()));
        exitCode = commandLine.execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
