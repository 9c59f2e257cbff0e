package com.gnovoa.swiss.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.swiss.rosters.InMemoryPairingStore;
import com.gnovoa.swiss.rosters.IntentionalByeRounds;
import com.gnovoa.swiss.rosters.PairingStore;
import com.gnovoa.swiss.schedule.BursteinSystem;
import com.gnovoa.swiss.schedule.ColorAllocator;
import com.gnovoa.swiss.schedule.DutchSystem;
import com.gnovoa.swiss.schedule.PairingSystem;
import com.gnovoa.swiss.schedule.TiebreakCalculator;
import com.gnovoa.swiss.trf.FideCompliance;
import com.gnovoa.swiss.trf.PairingOutputFormatter;
import com.gnovoa.swiss.trf.RankCalculator;
import com.gnovoa.swiss.trf.TrfParser;
import com.gnovoa.swiss.trf.TrfWriter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class PairingWiring {

    @Bean
    public ColorAllocator colorAllocator() {
        return new ColorAllocator();
    }

    @Bean
    public TiebreakCalculator tiebreakCalculator() {
        return new TiebreakCalculator();
    }

    @Bean
    public PairingSystem dutchSystem(ColorAllocator colors) {
        return new DutchSystem(colors);
    }

    @Bean
    public PairingSystem bursteinSystem(ColorAllocator colors, TiebreakCalculator tiebreaks) {
        return new BursteinSystem(colors, tiebreaks);
    }

    @Bean
    public RankCalculator rankCalculator() {
        return new RankCalculator();
    }

    @Bean
    public TrfParser trfParser() {
        return new TrfParser();
    }

    @Bean
    public TrfWriter trfWriter(RankCalculator ranks) {
        return new TrfWriter(ranks);
    }

    @Bean
    public FideCompliance fideCompliance(ColorAllocator colors) {
        return new FideCompliance(colors);
    }

    @Bean
    public PairingOutputFormatter pairingOutputFormatter() {
        return new PairingOutputFormatter();
    }

    @Bean
    public IntentionalByeRounds intentionalByeRounds(ObjectMapper mapper) {
        return new IntentionalByeRounds(mapper);
    }

    @Bean
    public HistoryReconstructor historyReconstructor(IntentionalByeRounds byeRounds, RankCalculator ranks) {
        return new HistoryReconstructor(byeRounds, ranks);
    }

    /** Stand-in store; an application with a real store declares its own {@link PairingStore}. */
    @Bean
    @ConditionalOnMissingBean(PairingStore.class)
    public InMemoryPairingStore inMemoryPairingStore(ObjectMapper mapper) {
        return new InMemoryPairingStore(mapper);
    }

    @Bean
    public PairingRunner pairingRunner(PairingStore store, HistoryReconstructor reconstructor, List<PairingSystem> systems,
                                       FideCompliance compliance, TrfWriter trfWriter, PairingOutputFormatter formatter,
                                       PairingProperties props) {
        return new PairingRunner(store, reconstructor, systems, compliance, trfWriter, formatter, props);
    }
}
