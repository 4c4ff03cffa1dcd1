package ch.so.arp.lograg.query;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults applied to questions that leave parameters open.
 */
@ConfigurationProperties(prefix = "lograg.query")
public class QueryProperties {

    /**
     * Collection questions are answered from.
     */
    private String collection = "aks_logs";

    private int defaultK = 5;

    /**
     * Minimum cosine similarity of a passage used as evidence.
     */
    private double defaultThreshold = 0.4d;

    /**
     * Maximum number of earlier turns forwarded to the language model.
     */
    private int maxHistory = 10;

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }

    public int getDefaultK() {
        return defaultK;
    }

    public void setDefaultK(int defaultK) {
        this.defaultK = defaultK;
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    public void setDefaultThreshold(double defaultThreshold) {
        this.defaultThreshold = defaultThreshold;
    }

    public int getMaxHistory() {
        return maxHistory;
    }

    public void setMaxHistory(int maxHistory) {
        this.maxHistory = maxHistory;
    }
}
