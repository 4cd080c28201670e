package com.spreadsheet.calc.functions;

/**
 * Registry entry: name, arity bounds, category and handler.
 * When propagatesErrors is set, the registry returns the first error-valued
 * scalar argument without calling the handler.
 */
public final class FunctionDefinition {

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final String name;
    private final String category;
    private final int minArgs;
    private final int maxArgs;
    private final boolean propagatesErrors;
    private final ExcelFunction handler;

    public FunctionDefinition(String name, String category, int minArgs, int maxArgs,
                              boolean propagatesErrors, ExcelFunction handler) {
        this.name = name;
        this.category = category;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.propagatesErrors = propagatesErrors;
        this.handler = handler;
    }

    public String getName() {
        return name;
    }

    public String getCategory() {
        return category;
    }

    public int getMinArgs() {
        return minArgs;
    }

    public int getMaxArgs() {
        return maxArgs;
    }

    public boolean propagatesErrors() {
        return propagatesErrors;
    }

    public ExcelFunction getHandler() {
        return handler;
    }
}
