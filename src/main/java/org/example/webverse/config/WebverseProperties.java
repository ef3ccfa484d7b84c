package org.example.webverse.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Process-wide settings, bound once at startup and handed to the stages.
 */
@Component
@ConfigurationProperties(prefix = "webverse")
public class WebverseProperties {

    private Pipeline pipeline = new Pipeline();
    private Generation generation = new Generation();
    private Writer writer = new Writer();
    private Illustrator illustrator = new Illustrator();

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline == null ? new Pipeline() : pipeline;
    }

    public Generation getGeneration() {
        return generation;
    }

    public void setGeneration(Generation generation) {
        this.generation = generation == null ? new Generation() : generation;
    }

    public Writer getWriter() {
        return writer;
    }

    public void setWriter(Writer writer) {
        this.writer = writer == null ? new Writer() : writer;
    }

    public Illustrator getIllustrator() {
        return illustrator;
    }

    public void setIllustrator(Illustrator illustrator) {
        this.illustrator = illustrator == null ? new Illustrator() : illustrator;
    }

    public static class Pipeline {
        private int timeoutSeconds = 300;
        private int workerThreads = 4;

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }

    public static class Generation {
        private int maxConcurrentCalls = 4;
        private int acquireTimeoutSeconds = 30;

        public int getMaxConcurrentCalls() {
            return maxConcurrentCalls;
        }

        public void setMaxConcurrentCalls(int maxConcurrentCalls) {
            this.maxConcurrentCalls = maxConcurrentCalls;
        }

        public int getAcquireTimeoutSeconds() {
            return acquireTimeoutSeconds;
        }

        public void setAcquireTimeoutSeconds(int acquireTimeoutSeconds) {
            this.acquireTimeoutSeconds = acquireTimeoutSeconds;
        }
    }

    public static class Writer {
        private int historyWindow = 5;
        private double temperature = 0.9;

        public int getHistoryWindow() {
            return historyWindow;
        }

        public void setHistoryWindow(int historyWindow) {
            this.historyWindow = historyWindow;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }
    }

    public static class Illustrator {
        private int historyWindow = 3;
        private double temperature = 0.7;

        public int getHistoryWindow() {
            return historyWindow;
        }

        public void setHistoryWindow(int historyWindow) {
            this.historyWindow = historyWindow;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }
    }
}
