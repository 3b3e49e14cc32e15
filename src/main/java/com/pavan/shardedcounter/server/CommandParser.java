package com.pavan.shardedcounter.server;

/**
 * Parses whitespace-separated text commands into Command objects.
 */
public class CommandParser {
    
    /**
     * Parses a command string into a Command object.
     *
     * @param commandLine the command line to parse
     * @return the parsed Command
     */
    public Command parse(String commandLine) {
        if (commandLine == null || commandLine.trim().isEmpty()) {
            return new Command(Command.CommandType.UNKNOWN, new String[0]);
        }
        
        String[] parts = commandLine.trim().split("\\s+");
        String cmdStr = parts[0].toUpperCase();
        
        Command.CommandType type;
        try {
            type = Command.CommandType.valueOf(cmdStr);
        } catch (IllegalArgumentException e) {
            type = Command.CommandType.UNKNOWN;
        }
        
        String[] args = new String[parts.length - 1];
        System.arraycopy(parts, 1, args, 0, args.length);
        
        return new Command(type, args);
    }
    
    /**
     * Validates that a command has the required number of arguments.
     *
     * @param command the command to validate
     * @param minArgs minimum number of arguments required
     * @return true if valid, false otherwise
     */
    public boolean validateArgCount(Command command, int minArgs) {
        return command.getArgCount() >= minArgs;
    }
    
    /**
     * Validates that a command has between {@code minArgs} and {@code maxArgs} arguments.
     */
    public boolean validateArgRange(Command command, int minArgs, int maxArgs) {
        return command.getArgCount() >= minArgs && command.getArgCount() <= maxArgs;
    }
}
