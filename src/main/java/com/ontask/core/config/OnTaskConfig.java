package com.ontask.core.config;

import com.ontask.core.source.DailyNotesOrigin;
import com.ontask.core.source.DocumentAggregator;
import com.ontask.core.source.FolderOrigin;
import com.ontask.core.source.PeriodMatcher;
import com.ontask.core.source.StreamsOrigin;
import com.ontask.core.store.DocumentStore;
import com.ontask.core.store.FileSystemDocumentStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

@Configuration
public class OnTaskConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public DocumentStore documentStore(OnTaskProperties properties) {
        return new FileSystemDocumentStore(Path.of(properties.getVaultRoot()), properties.getVaultExtension());
    }

    @Bean
    public PeriodMatcher periodMatcher(Clock clock) {
        return new PeriodMatcher(clock);
    }

    /**
     * Origins are consulted in a fixed order (streams, daily notes, folder); that order
     * breaks filename ties in the aggregated list.
     */
    @Bean
    public DocumentAggregator documentAggregator(DocumentStore store, PeriodMatcher periodMatcher,
                                                 OnTaskProperties properties) {
        var folder = properties.getSources().getFolder();
        return new DocumentAggregator(
                List.of(
                        new StreamsOrigin(store, properties.getStreams()),
                        new DailyNotesOrigin(properties.getSources().getDailyNotes().isEnabled()),
                        new FolderOrigin(store, folder.getPath(), folder.isIncludeSubfolders())
                ),
                periodMatcher,
                store,
                properties.isTodayIncludesModified());
    }
}
