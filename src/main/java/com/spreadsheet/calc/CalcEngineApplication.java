package com.spreadsheet.calc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spreadsheet calculation engine.
 *
 * Loads a workbook analysis document, calculates every formula and validates
 * the results. Run with --calc.cli.analysis=path/to/analysis.json.
 */
@SpringBootApplication
public class CalcEngineApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CalcEngineApplication.class, args)));
    }
}
