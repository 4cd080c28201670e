package com.spreadsheet.calc.config;

import com.spreadsheet.calc.models.CalcMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Settings of the calculation engine and of result validation.
 * Configured via application.properties under calc.engine.
 */
@Component
@ConfigurationProperties(prefix = "calc.engine")
public class EngineProperties {

    /**
     * AUTOMATIC recalculates after every change, MANUAL only marks cells dirty.
     */
    private CalcMode calcMode = CalcMode.AUTOMATIC;

    /**
     * When false every cell in a cycle gets #CIRCULAR! right away.
     */
    private boolean iterativeCalculation = true;

    private int maxIterations = 100;

    /**
     * A cycle has converged once no member changes by this much or more.
     */
    private double epsilon = 0.001;

    private char listSeparator = ',';

    /**
     * Worker threads per calculation layer; 1 keeps everything on the calling thread.
     */
    private int parallelism = 1;

    private final Validation validation = new Validation();

    public CalcMode getCalcMode() {
        return calcMode;
    }

    public void setCalcMode(CalcMode calcMode) {
        this.calcMode = calcMode;
    }

    public boolean isIterativeCalculation() {
        return iterativeCalculation;
    }

    public void setIterativeCalculation(boolean iterativeCalculation) {
        this.iterativeCalculation = iterativeCalculation;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1");
        }
        this.maxIterations = maxIterations;
    }

    public double getEpsilon() {
        return epsilon;
    }

    public void setEpsilon(double epsilon) {
        if (epsilon <= 0) {
            throw new IllegalArgumentException("epsilon must be positive");
        }
        this.epsilon = epsilon;
    }

    public char getListSeparator() {
        return listSeparator;
    }

    public void setListSeparator(char listSeparator) {
        this.listSeparator = listSeparator;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        this.parallelism = parallelism;
    }

    public Validation getValidation() {
        return validation;
    }

    public static class Validation {

        private double absoluteTolerance = 1e-6;
        private double relativeTolerance = 1e-9;

        /**
         * Minimum pass rate in percent for a run to be accepted.
         */
        private double acceptanceThreshold = 95.0;

        /**
         * Error codes that count as a resolved result.
         */
        private List<String> acceptedErrorCodes = new ArrayList<>(Arrays.asList("#N/A", "#DIV/0!"));

        public double getAbsoluteTolerance() {
            return absoluteTolerance;
        }

        public void setAbsoluteTolerance(double absoluteTolerance) {
            this.absoluteTolerance = absoluteTolerance;
        }

        public double getRelativeTolerance() {
            return relativeTolerance;
        }

        public void setRelativeTolerance(double relativeTolerance) {
            this.relativeTolerance = relativeTolerance;
        }

        public double getAcceptanceThreshold() {
            return acceptanceThreshold;
        }

        public void setAcceptanceThreshold(double acceptanceThreshold) {
            this.acceptanceThreshold = acceptanceThreshold;
        }

        public List<String> getAcceptedErrorCodes() {
            return acceptedErrorCodes;
        }

        public void setAcceptedErrorCodes(List<String> acceptedErrorCodes) {
            this.acceptedErrorCodes = acceptedErrorCodes;
        }
    }
}
