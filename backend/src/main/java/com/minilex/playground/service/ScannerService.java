package com.minilex.playground.service;

import com.minilex.playground.config.ScannerProperties;
import com.minilex.playground.dto.ScanRequest;
import com.minilex.playground.dto.ScanResponse;
import com.minilex.playground.dto.ScannedToken;
import com.minilex.playground.exception.ScanRejectedException;
import com.minilex.playground.lexer.Scanner;
import com.minilex.playground.lexer.Token;
import com.minilex.playground.lexer.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class ScannerService {

    private static final Logger logger = LoggerFactory.getLogger(ScannerService.class);

    private final ScannerProperties properties;

    public ScannerService(ScannerProperties properties) {
        this.properties = properties;
    }

    /**
     * Scans the request source. Input the service refuses to scan (missing,
     * too long, too many tokens) is thrown back to the caller; invalid tokens
     * are reported or turned into an error response depending on
     * {@code reject-invalid}.
     */
    public ScanResponse scan(ScanRequest request) throws ScanRejectedException {
        long startTime = System.currentTimeMillis();

        try {
            String sourceCode = request.sourceCode();
            logger.info("Starting scan of {} characters", sourceCode != null ? sourceCode.length() : 0);

            List<Token> tokens = tokenize(sourceCode);

            List<ScannedToken> scanned = new ArrayList<>(tokens.size());
            Token firstInvalid = null;
            int invalidCount = 0;

            for (int i = 0; i < tokens.size(); i++) {
                Token token = tokens.get(i);
                if (token.kind() == TokenKind.INVALID) {
                    invalidCount++;
                    if (firstInvalid == null) {
                        firstInvalid = token;
                    }
                }
                logger.debug("Token {}: '{}' -> {} at [{}-{}]",
                        i, token.text(), token.kind(), token.offset(), token.end());
                scanned.add(ScannedToken.from(token));
            }

            long analysisTime = System.currentTimeMillis() - startTime;

            if (firstInvalid != null && properties.rejectInvalid()) {
                logger.warn("Rejecting source with {} invalid tokens, first '{}' at offset {}",
                        invalidCount, firstInvalid.text(), firstInvalid.offset());
                return ScanResponse.error(
                        "Invalid input '" + firstInvalid.text() + "' at offset " + firstInvalid.offset(),
                        analysisTime);
            }

            logger.info("Scan completed in {}ms with {} tokens ({} invalid)",
                    analysisTime, scanned.size(), invalidCount);

            return ScanResponse.success(scanned, invalidCount, analysisTime);

        } catch (ScanRejectedException e) {
            logger.warn("Scan rejected: {}", e.getMessage());
            throw e;
        } catch (Exception e) {
            long analysisTime = System.currentTimeMillis() - startTime;
            logger.error("Scan failed", e);
            return ScanResponse.error("Scan failed: " + e.getMessage(), analysisTime);
        }
    }

    /**
     * Pulls tokens until end of input. The end-of-input token itself is not
     * part of the result.
     */
    public List<Token> tokenize(String sourceCode) throws ScanRejectedException {
        checkSource(sourceCode);

        Scanner scanner = new Scanner(sourceCode);
        List<Token> tokens = new ArrayList<>();

        for (Token token = scanner.next(); !token.isEndOfInput(); token = scanner.next()) {
            if (tokens.size() >= properties.maxTokens()) {
                throw new ScanRejectedException(
                        "Source produced more than " + properties.maxTokens() + " tokens");
            }
            tokens.add(token);
        }

        return tokens;
    }

    /**
     * Console form of the token stream: one {@code display : text} line per token.
     */
    public String render(String sourceCode) throws ScanRejectedException {
        List<Token> tokens = tokenize(sourceCode);
        logger.debug("Rendering {} tokens", tokens.size());

        return tokens.stream()
                .map(token -> token.kind().display() + " : " + token.text())
                .collect(Collectors.joining("\n"));
    }

    private void checkSource(String sourceCode) throws ScanRejectedException {
        if (sourceCode == null) {
            throw new ScanRejectedException("Source code cannot be null");
        }

        if (sourceCode.length() > properties.maxSourceLength()) {
            throw new ScanRejectedException(
                    "Source code exceeds maximum length of " + properties.maxSourceLength() + " characters");
        }
    }
}
