package com.scroll.ocr.cli;

import com.scroll.ocr.config.ScrollOcrConfig;
import com.scroll.ocr.core.chat.ChatProcessingResult;
import com.scroll.ocr.core.stitcher.StitchConfiguration;
import com.scroll.ocr.core.stitcher.StitchResult;
import com.scroll.ocr.dto.RunReport;
import com.scroll.ocr.exception.NoTextExtractedException;
import com.scroll.ocr.exception.ScrollOcrException;
import com.scroll.ocr.service.ScreenshotOcrService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * 命令行入口：拼接截图 → OCR → （可选）聊天格式化
 */
@Component
@Scope("prototype")
@Command(name = "scroll-ocr", mixinStandardHelpOptions = true, version = "scroll-ocr 1.0.0",
    description = "Stitch overlapping screenshots and extract text with OCR",
    footer = {"", "Examples:",
        "  scroll-ocr image1.png image2.png image3.png",
        "  scroll-ocr *.png -o output.png --chat",
        "  scroll-ocr screenshots/*.png --text-only"})
public class ScreenshotOcrCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(ScreenshotOcrCommand.class);

    private static final String RULE = "=".repeat(60);

    @Spec
    CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "IMAGE", description = "Screenshot image files to stitch (in order)")
    List<Path> images = new ArrayList<>();

    @Option(names = {"-o", "--output"}, paramLabel = "FILE",
        description = "Output image file path (default: stitched_output.png)")
    Path output;

    @Option(names = {"-t", "--text-output"}, paramLabel = "FILE",
        description = "Text output file path (default: extracted_text.txt)")
    Path textOutput;

    @Option(names = "--chat", description = "Enable chat conversation detection and formatting")
    boolean chat;

    @Option(names = "--text-only", description = "Only extract text, don't save stitched image")
    boolean textOnly;

    @Option(names = "--overlap-threshold", paramLabel = "0-1",
        description = "Minimum overlap detection threshold 0-1 (default: 0.80)")
    Double overlapThreshold;

    @Option(names = "--sweep-step", paramLabel = "ROWS",
        description = "Step between candidate overlap heights in rows (default: 10)")
    Integer sweepStep;

    @Option(names = "--no-preprocess", description = "Disable image preprocessing for OCR")
    boolean noPreprocess;

    @Option(names = "--lang", paramLabel = "CODE", description = "Tesseract language code (default: eng)")
    String language;

    @Option(names = "--report", paramLabel = "FILE", description = "Write a JSON run report to FILE")
    Path report;

    private final ScreenshotOcrService service;
    private final ScrollOcrConfig config;

    public ScreenshotOcrCommand(ScreenshotOcrService service, ScrollOcrConfig config) {
        this.service = service;
        this.config = config;
    }

    /**
     * 统一错误出口：参数错误和执行异常都返回 1
     */
    public static CommandLine configure(CommandLine commandLine) {
        commandLine.setParameterExceptionHandler((ex, args) -> {
            PrintWriter err = ex.getCommandLine().getErr();
            err.println("Error: " + ex.getMessage());
            ex.getCommandLine().usage(err);
            return 1;
        });
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            logger.error("Unexpected error", ex);
            cmd.getErr().println("Unexpected error: " + ex.getMessage());
            return 1;
        });
        return commandLine;
    }

    @Override
    public Integer call() {
        if (overlapThreshold != null && (overlapThreshold < 0.0 || overlapThreshold > 1.0)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "--overlap-threshold must be between 0 and 1, got " + overlapThreshold);
        }
        if (sweepStep != null && sweepStep < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "--sweep-step must be at least 1, got " + sweepStep);
        }

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path imageOutput = output != null ? output : Path.of(config.getOutput().getImage());
        Path textPath = textOutput != null ? textOutput : Path.of(config.getOutput().getText());
        String lang = language != null ? language : config.getOcr().getLanguage();
        boolean preprocess = config.getOcr().isPreprocess() && !noPreprocess;

        out.println("Screenshot OCR Stitcher");
        out.println(RULE);

        RunReport runReport = new RunReport();
        runReport.setStartedAt(Instant.now());

        StitchResult stitched = null;
        try {
            List<Path> validated = service.validateImages(images);
            out.println("Input images: " + validated.size());

            // 1. 拼接
            out.println();
            out.println("[1/3] Stitching images...");
            StitchConfiguration configuration = service.resolveConfiguration(overlapThreshold, sweepStep);
            stitched = service.stitch(validated, configuration);
            if (!textOnly) {
                service.saveImage(stitched.getComposite(), imageOutput);
                out.println("✓ Stitched image saved to: " + imageOutput);
            }

            // 2. OCR
            out.println();
            out.println("[2/3] Extracting text with OCR...");
            String text;
            try {
                text = service.extractText(stitched.getComposite(), lang, preprocess);
            } catch (NoTextExtractedException e) {
                out.println("Warning: " + e.getMessage());
                return 1;
            }
            out.println("✓ Extracted " + text.length() + " characters");

            // 3. 聊天格式化
            out.println();
            out.println("[3/3] Processing extracted text...");
            String finalText = text;
            ChatProcessingResult chatResult = null;
            if (chat) {
                chatResult = service.processChat(text);
                if (chatResult.isChatDetected()) {
                    out.println("✓ Chat conversation detected!");
                    finalText = chatResult.getText();
                } else {
                    out.println("No chat pattern detected, using raw text");
                }
            }

            service.saveText(finalText, textPath);
            out.println("✓ Text saved to: " + textPath);

            printPreview(out, finalText);
            out.println();
            out.println("✓ Processing complete!");

            out.println();
            out.println("Summary:");
            out.println("  Images stitched: " + validated.size());
            out.println("  Output image: " + (textOnly ? "N/A (text-only mode)" : imageOutput.toString()));
            out.println("  Output text: " + textPath);
            out.println("  Characters extracted: " + text.length());
            if (chat) {
                out.println("  Chat detected: " + (chatResult.isChatDetected() ? "Yes" : "No"));
            }

            if (report != null) {
                fillReport(runReport, validated, stitched, configuration, imageOutput, textPath, lang, preprocess,
                    text, chatResult);
                service.writeReport(runReport, report);
                out.println("  Report: " + report);
            }
            out.flush();
            return 0;
        } catch (ScrollOcrException e) {
            logger.debug("Run failed", e);
            out.flush();
            err.println("Error: " + e.getMessage());
            return 1;
        } finally {
            if (stitched != null) {
                stitched.getComposite().release();
            }
        }
    }

    private void printPreview(PrintWriter out, String finalText) {
        int limit = config.getOutput().getPreviewLength();
        out.println();
        out.println(RULE);
        out.println("TEXT PREVIEW (first " + limit + " characters):");
        out.println(RULE);
        String preview = finalText.length() > limit ? finalText.substring(0, limit) : finalText;
        if (finalText.length() > limit) {
            preview += "\n... (truncated)";
        }
        out.println(preview);
        out.println(RULE);
    }

    private void fillReport(RunReport runReport, List<Path> inputs, StitchResult stitched,
                            StitchConfiguration configuration, Path imageOutput, Path textPath,
                            String lang, boolean preprocess, String text, ChatProcessingResult chatResult) {
        for (Path input : inputs) {
            runReport.getInputImages().add(input.toString());
        }
        for (Path skipped : stitched.getSkippedPaths()) {
            runReport.getSkippedImages().add(skipped.toString());
        }
        runReport.setMergedCount(stitched.getMergedCount());
        runReport.setWidth(stitched.getWidth());
        runReport.setHeight(stitched.getHeight());
        runReport.setOverlapThreshold(configuration.getOverlapThreshold());
        runReport.setOverlapRegions(new ArrayList<>(stitched.getOverlapRegions()));
        runReport.setOutputImage(textOnly ? null : imageOutput.toString());
        runReport.setOutputText(textPath.toString());
        runReport.setLanguage(lang);
        runReport.setPreprocessed(preprocess);
        runReport.setCharacterCount(text.length());
        if (chatResult != null) {
            runReport.setChatDetected(chatResult.isChatDetected());
            if (chatResult.isChatDetected()) {
                runReport.setMessageCount(chatResult.getMessages().size());
                runReport.setParticipants(new ArrayList<>(chatResult.getSummary().getParticipants()));
            }
        }
        runReport.setFinishedAt(Instant.now());
    }
}
