package com.ontask.core.config;

import com.ontask.core.model.RankTier;
import com.ontask.core.model.StatusConfig;
import com.ontask.core.source.StreamsOrigin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "ontask")
public class OnTaskProperties {

    private Vault vault = new Vault();
    private Scan scan = new Scan();
    private Sources sources = new Sources();
    private Ranking ranking = new Ranking();
    private List<Status> statuses = defaultStatuses();

    // -- Flattened accessors --
    public String getVaultRoot() { return vault.root; }
    public String getVaultExtension() { return vault.extension; }
    public int getLoadMoreLimit() { return scan.loadMoreLimit; }
    public boolean isOnlyShowToday() { return scan.onlyShowToday; }
    public boolean isTodayIncludesModified() { return scan.todayIncludesModified; }

    /** Configured status list as immutable records. */
    public List<StatusConfig> getStatusConfigs() {
        return statuses.stream()
                .map(s -> new StatusConfig(s.symbol, s.name, s.description, s.filtered))
                .toList();
    }

    /** Configured tiers as immutable records; entries without a single-character symbol are dropped. */
    public List<RankTier> getRankTiers() {
        return ranking.tiers.stream()
                .filter(t -> t.symbol != null && t.symbol.length() == 1)
                .map(t -> new RankTier(t.symbol.charAt(0), t.priority))
                .toList();
    }

    public List<StreamsOrigin.Stream> getStreams() {
        return sources.streams.stream()
                .map(s -> new StreamsOrigin.Stream(s.name, s.folder))
                .toList();
    }

    public Vault getVault() { return vault; }
    public void setVault(Vault vault) { this.vault = vault; }
    public Scan getScan() { return scan; }
    public void setScan(Scan scan) { this.scan = scan; }
    public Sources getSources() { return sources; }
    public void setSources(Sources sources) { this.sources = sources; }
    public Ranking getRanking() { return ranking; }
    public void setRanking(Ranking ranking) { this.ranking = ranking; }
    public List<Status> getStatuses() { return statuses; }
    public void setStatuses(List<Status> statuses) { this.statuses = statuses; }

    private static List<Status> defaultStatuses() {
        var list = new ArrayList<Status>();
        for (StatusConfig c : StatusConfig.defaults()) {
            var s = new Status();
            s.setSymbol(c.symbol());
            s.setName(c.name());
            s.setDescription(c.description());
            s.setFiltered(c.filtered());
            list.add(s);
        }
        return list;
    }

    public static class Vault {
        private String root = ".";
        private String extension = ".md";

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public String getExtension() { return extension; }
        public void setExtension(String extension) { this.extension = extension; }
    }

    public static class Scan {
        private int loadMoreLimit = 10;
        private boolean onlyShowToday = false;
        private boolean todayIncludesModified = false;

        public int getLoadMoreLimit() { return loadMoreLimit; }
        public void setLoadMoreLimit(int loadMoreLimit) { this.loadMoreLimit = loadMoreLimit; }
        public boolean isOnlyShowToday() { return onlyShowToday; }
        public void setOnlyShowToday(boolean onlyShowToday) { this.onlyShowToday = onlyShowToday; }
        public boolean isTodayIncludesModified() { return todayIncludesModified; }
        public void setTodayIncludesModified(boolean todayIncludesModified) { this.todayIncludesModified = todayIncludesModified; }
    }

    public static class Sources {
        private List<Stream> streams = new ArrayList<>();
        private DailyNotes dailyNotes = new DailyNotes();
        private Folder folder = new Folder();

        public List<Stream> getStreams() { return streams; }
        public void setStreams(List<Stream> streams) { this.streams = streams; }
        public DailyNotes getDailyNotes() { return dailyNotes; }
        public void setDailyNotes(DailyNotes dailyNotes) { this.dailyNotes = dailyNotes; }
        public Folder getFolder() { return folder; }
        public void setFolder(Folder folder) { this.folder = folder; }
    }

    public static class Stream {
        private String name = "";
        private String folder = "";

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getFolder() { return folder; }
        public void setFolder(String folder) { this.folder = folder; }
    }

    public static class DailyNotes {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class Folder {
        private String path = "";
        private boolean includeSubfolders = true;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public boolean isIncludeSubfolders() { return includeSubfolders; }
        public void setIncludeSubfolders(boolean includeSubfolders) { this.includeSubfolders = includeSubfolders; }
    }

    public static class Ranking {
        private List<Tier> tiers = new ArrayList<>(List.of(
                new Tier("/", 1), new Tier("!", 2), new Tier("+", 3)));

        public List<Tier> getTiers() { return tiers; }
        public void setTiers(List<Tier> tiers) { this.tiers = tiers; }
    }

    public static class Tier {
        private String symbol = "";
        private int priority;

        public Tier() {}

        public Tier(String symbol, int priority) {
            this.symbol = symbol;
            this.priority = priority;
        }

        public String getSymbol() { return symbol; }
        public void setSymbol(String symbol) { this.symbol = symbol; }
        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }
    }

    public static class Status {
        private String symbol = "";
        private String name = "";
        private String description = "";
        private boolean filtered = true;

        public String getSymbol() { return symbol; }
        public void setSymbol(String symbol) { this.symbol = symbol; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public boolean isFiltered() { return filtered; }
        public void setFiltered(boolean filtered) { this.filtered = filtered; }
    }
}
