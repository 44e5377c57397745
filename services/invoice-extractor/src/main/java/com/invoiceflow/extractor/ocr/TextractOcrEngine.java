package com.invoiceflow.extractor.ocr;

import java.util.List;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.BadDocumentException;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BlockType;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextRequest;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextResponse;
import software.amazon.awssdk.services.textract.model.Document;
import software.amazon.awssdk.services.textract.model.DocumentTooLargeException;
import software.amazon.awssdk.services.textract.model.InternalServerErrorException;
import software.amazon.awssdk.services.textract.model.InvalidParameterException;
import software.amazon.awssdk.services.textract.model.LimitExceededException;
import software.amazon.awssdk.services.textract.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.textract.model.TextractException;
import software.amazon.awssdk.services.textract.model.ThrottlingException;
import software.amazon.awssdk.services.textract.model.UnsupportedDocumentException;

/**
 * Primary OCR engine: synchronous AWS Textract text detection.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TextractOcrEngine implements OcrEngine {

    public static final String NAME = "textract";

    private final TextractClient textractClient;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public OcrResult extractText(byte[] document, String filename) {
        DetectDocumentTextResponse response;
        try {
            response = textractClient.detectDocumentText(DetectDocumentTextRequest.builder()
                    .document(Document.builder().bytes(SdkBytes.fromByteArray(document)).build())
                    .build());
        } catch (UnsupportedDocumentException | BadDocumentException
                | DocumentTooLargeException | InvalidParameterException e) {
            throw new OcrEngineException(OcrEngineException.Kind.UNSUPPORTED_DOCUMENT,
                    "Textract cannot process " + filename + ": " + errorCode(e), e);
        } catch (ThrottlingException | ProvisionedThroughputExceededException
                | LimitExceededException | InternalServerErrorException e) {
            throw new OcrEngineException(OcrEngineException.Kind.TRANSIENT,
                    "Textract unavailable: " + errorCode(e), e);
        } catch (TextractException e) {
            OcrEngineException.Kind kind = e.statusCode() == 429 || e.statusCode() >= 500
                    ? OcrEngineException.Kind.TRANSIENT
                    : OcrEngineException.Kind.ENGINE_FAILURE;
            throw new OcrEngineException(kind, "Textract error: " + errorCode(e), e);
        } catch (SdkClientException e) {
            // network failures and client-side timeouts
            throw new OcrEngineException(OcrEngineException.Kind.TRANSIENT,
                    "Textract call failed: " + e.getMessage(), e);
        }

        return toResult(response.blocks());
    }

    static OcrResult toResult(List<Block> blocks) {
        String text = blocks.stream()
                .filter(block -> block.blockType() == BlockType.LINE)
                .map(Block::text)
                .filter(line -> line != null)
                .collect(Collectors.joining("\n"));

        OptionalDouble average = blocks.stream()
                .map(Block::confidence)
                .filter(value -> value != null)
                .mapToDouble(Float::doubleValue)
                .average();
        // Textract reports percentages
        Double confidence = average.isPresent() ? average.getAsDouble() / 100.0 : null;

        return OcrResult.builder()
                .text(text)
                .confidence(confidence)
                .engine(NAME)
                .build();
    }

    private static String errorCode(TextractException e) {
        if (e.awsErrorDetails() != null && e.awsErrorDetails().errorCode() != null) {
            return e.awsErrorDetails().errorCode();
        }
        return e.getMessage();
    }
}
