package com.gnovoa.swiss.runner;

import com.gnovoa.swiss.model.Pairing;
import com.gnovoa.swiss.trf.PairingOutputFormatter;
import com.gnovoa.swiss.trf.TrfDocument;
import com.gnovoa.swiss.trf.TrfParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Pairs {@code pairing.trf.input} once the application is ready, JaVaFo style.
 */
@Component
public final class TrfBootstrap {

    private static final Logger log = LoggerFactory.getLogger(TrfBootstrap.class);

    private final PairingProperties props;
    private final TrfParser parser;
    private final PairingRunner runner;
    private final PairingOutputFormatter formatter;

    public TrfBootstrap(PairingProperties props, TrfParser parser, PairingRunner runner, PairingOutputFormatter formatter) {
        this.props = props;
        this.parser = parser;
        this.runner = runner;
        this.formatter = formatter;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        String input = props.trf().input();
        if (input == null || input.isBlank()) return;
        pairFile(Path.of(input));
    }

    /**
     * @return the JaVaFo pairing block that was written or logged
     * @throws IllegalStateException if a file cannot be read or written
     */
    public String pairFile(Path input) {
        TrfDocument document;
        try {
            document = parser.parse(Files.readString(input, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read TRF file " + input, e);
        }

        List<Pairing> pairings = runner.pairTrf(document, props.systemType());
        String block = formatter.format(pairings);

        String output = props.trf().output();
        if (output == null || output.isBlank()) {
            log.info("Pairings for round {} of {}:\n{}", document.playedRounds() + 1, input, block);
        } else {
            Path target = Path.of(output);
            try {
                Files.writeString(target, block + "\n", StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to write pairings to " + target, e);
            }
            log.info("Wrote {} boards for round {} to {}", pairings.size(), document.playedRounds() + 1, target);
        }
        return block;
    }
}
