package com.gnovoa.swiss.runner;

import com.gnovoa.swiss.exception.FormatLimitException;
import com.gnovoa.swiss.exception.MalformedHistoryException;
import com.gnovoa.swiss.exception.UnsatisfiablePairingException;
import com.gnovoa.swiss.model.Pairing;
import com.gnovoa.swiss.model.Tournament;
import com.gnovoa.swiss.rosters.PairingRow;
import com.gnovoa.swiss.rosters.PairingStore;
import com.gnovoa.swiss.rosters.PlayerRow;
import com.gnovoa.swiss.rosters.StoredPairing;
import com.gnovoa.swiss.schedule.PairingSystem;
import com.gnovoa.swiss.schedule.PairingSystemType;
import com.gnovoa.swiss.trf.FideCompliance;
import com.gnovoa.swiss.trf.PairingOutputFormatter;
import com.gnovoa.swiss.trf.TrfDocument;
import com.gnovoa.swiss.trf.TrfWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the engine: loads a section from the {@link PairingStore}, rebuilds it,
 * runs the configured {@link PairingSystem} and numbers the boards.
 *
 * <p>Stateless apart from its collaborators; callers must not pair the same tournament
 * round concurrently.
 */
public final class PairingRunner {

    private static final Logger log = LoggerFactory.getLogger(PairingRunner.class);

    private final PairingStore store;
    private final HistoryReconstructor reconstructor;
    private final Map<PairingSystemType, PairingSystem> systems = new EnumMap<>(PairingSystemType.class);
    private final FideCompliance compliance;
    private final TrfWriter trfWriter;
    private final PairingOutputFormatter formatter;
    private final PairingProperties props;

    public PairingRunner(PairingStore store,
                         HistoryReconstructor reconstructor,
                         List<PairingSystem> systems,
                         FideCompliance compliance,
                         TrfWriter trfWriter,
                         PairingOutputFormatter formatter,
                         PairingProperties props) {
        this.store = store;
        this.reconstructor = reconstructor;
        systems.forEach(s -> this.systems.put(s.type(), s));
        this.compliance = compliance;
        this.trfWriter = trfWriter;
        this.formatter = formatter;
        this.props = props;
    }

    public PairingOutcome generatePairings(PairingRequest request) {
        String section = request.section() != null ? request.section() : props.section();
        PairingSystemType type = request.system() != null ? request.system() : props.systemType();

        if (request.tournamentId() == null || request.round() < 1) {
            return PairingOutcome.failure(PairingOutcome.ErrorKind.INVALID_REQUEST,
                    "A tournament id and a round of at least 1 are required",
                    new PairingOutcome.Metadata(request.tournamentId(), request.round(), section, type, 0, 0));
        }

        log.info("Pairing round {} of tournament {} ({}, section {})", request.round(), request.tournamentId(), type.code(), section);

        int activePlayers = 0;
        try {
            List<PlayerRow> roster = store.activePlayers(request.tournamentId(), request.section());
            List<PairingRow> history = store.pairingsBefore(request.tournamentId(), request.round(), request.section());
            activePlayers = roster.size();

            ReconstructedSection rebuilt = reconstructor.reconstruct(
                    roster,
                    history,
                    request.round(),
                    request.expectedRounds() != null ? request.expectedRounds() : props.expectedRounds(),
                    request.points() != null ? request.points() : props.points().toPointTable(),
                    props.initialColorValue());
            Tournament tournament = rebuilt.tournament();

            List<Pairing> boards = number(pair(tournament, type), section);

            List<StoredPairing> stored = new ArrayList<>(boards.size());
            int byes = 0;
            for (Pairing p : boards) {
                if (p.isBye()) byes++;
                stored.add(new StoredPairing(
                        rebuilt.storeId(p.whiteId()),
                        p.isBye() ? null : rebuilt.storeId(p.blackId()),
                        p.isBye(),
                        p.isBye() ? p.byeType().code() : null,
                        p.board(),
                        p.section()));
            }

            String trfSnapshot = request.includeTrf() ? trfWriter.write(tournament) : null;
            String trfPairings = request.includeTrf() ? formatter.format(boards) : null;

            PairingOutcome.Metadata metadata = new PairingOutcome.Metadata(
                    request.tournamentId(), request.round(), section, type, activePlayers, byes);
            log.info("Round {} of tournament {}: {} boards, {} byes", request.round(), request.tournamentId(), stored.size(), byes);
            return PairingOutcome.success(stored, trfSnapshot, trfPairings, metadata);

        } catch (UnsatisfiablePairingException e) {
            return failed(PairingOutcome.ErrorKind.UNSATISFIABLE_PAIRING, e, request, section, type, activePlayers);
        } catch (FormatLimitException e) {
            return failed(PairingOutcome.ErrorKind.FORMAT_LIMIT, e, request, section, type, activePlayers);
        } catch (MalformedHistoryException e) {
            return failed(PairingOutcome.ErrorKind.MALFORMED_HISTORY, e, request, section, type, activePlayers);
        }
    }

    /** Pairs the round after the last one in a TRF file. */
    public List<Pairing> pairTrf(TrfDocument document, PairingSystemType type) {
        return number(pair(document.toTournament(), type), props.section());
    }

    private List<Pairing> pair(Tournament tournament, PairingSystemType type) {
        PairingSystem system = systems.get(type);
        if (system == null) throw new IllegalStateException("No pairing system registered for " + type);

        List<Pairing> pairings = system.computeMatching(tournament);
        List<FideCompliance.Violation> violations = compliance.checkRound(tournament, pairings);
        if (!violations.isEmpty()) {
            log.warn("Round {} has {} rule violations: {}", tournament.nextRound(), violations.size(), violations);
        }
        return pairings;
    }

    private List<Pairing> number(List<Pairing> pairings, String section) {
        List<Pairing> numbered = new ArrayList<>(pairings.size());
        int board = props.startingBoard();
        for (Pairing p : pairings) numbered.add(p.onBoard(board++, section));
        return numbered;
    }

    private PairingOutcome failed(PairingOutcome.ErrorKind kind, RuntimeException e, PairingRequest request,
                                  String section, PairingSystemType type, int activePlayers) {
        log.warn("Pairing round {} of tournament {} failed ({}): {}", request.round(), request.tournamentId(), kind, e.getMessage());
        return PairingOutcome.failure(kind, e.getMessage(),
                new PairingOutcome.Metadata(request.tournamentId(), request.round(), section, type, activePlayers, 0));
    }
}
