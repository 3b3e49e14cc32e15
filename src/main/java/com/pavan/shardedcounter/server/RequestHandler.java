package com.pavan.shardedcounter.server;

import com.pavan.shardedcounter.counter.ShardedCounter;
import com.pavan.shardedcounter.metrics.StatsCollector;
import com.pavan.shardedcounter.store.ShardStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Handles command execution and generates responses.
 * Separated from I/O logic for better testability and maintainability.
 */
public class RequestHandler {
    
    private static final Logger logger = LoggerFactory.getLogger(RequestHandler.class);
    
    private final ShardedCounter<String> counter;
    private final CommandParser parser;
    private final AtomicLong totalCommands;
    private final AtomicLong totalConnections;
    private final AtomicLong activeConnections;
    
    public RequestHandler(ShardedCounter<String> counter,
                         AtomicLong totalCommands,
                         AtomicLong totalConnections,
                         AtomicLong activeConnections) {
        this.counter = counter;
        this.parser = new CommandParser();
        this.totalCommands = totalCommands;
        this.totalConnections = totalConnections;
        this.activeConnections = activeConnections;
    }
    
    /**
     * Processes a command and returns a response.
     *
     * @param commandLine the command line to process
     * @return the response to send to the client
     */
    public Response handleCommand(String commandLine) {
        if (commandLine == null || commandLine.trim().isEmpty()) {
            return Response.error("Empty command");
        }
        
        Command command = parser.parse(commandLine);
        totalCommands.incrementAndGet();
        
        try {
            switch (command.getType()) {
                case ADD:
                    return handleAdd(command);
                case INCR:
                    return handleStep(command, 1);
                case DECR:
                    return handleStep(command, -1);
                case COUNT:
                    return handleCount(command);
                case ESTIMATE:
                    return handleEstimate(command);
                case REBALANCE:
                    return handleRebalance(command);
                case RESET:
                    return handleReset(command);
                case STATS:
                    return handleStats();
                case PING:
                    return Response.simpleString("PONG");
                case QUIT:
                    return Response.simpleString("Goodbye");
                case UNKNOWN:
                default:
                    return Response.error("Unknown command '" + commandLine.trim().split("\\s+")[0] + "'");
            }
        } catch (ShardStoreException e) {
            logger.warn("Store failure while handling '{}': {}", command.getType(), e.getMessage());
            return Response.error("Store failure: " + e.getMessage());
        } catch (Exception e) {
            return Response.error(e.getMessage());
        }
    }
    
    /**
     * Handles ADD name delta [shards [pin]] command.
     */
    private Response handleAdd(Command command) {
        if (!parser.validateArgRange(command, 2, 4)) {
            return Response.error("ADD requires name, delta and optional shards and pinned shard");
        }
        
        String name = command.getArg(0);
        double delta;
        try {
            delta = Double.parseDouble(command.getArg(1));
        } catch (NumberFormatException e) {
            return Response.error("Invalid delta value");
        }
        
        Integer shards = parseOptionalInt(command.getArg(2), "shard count");
        Integer pinned = parseOptionalInt(command.getArg(3), "pinned shard");
        
        int shardIndex = counter.add(name, delta, shards, pinned);
        return Response.integer(shardIndex);
    }
    
    /**
     * Handles INCR name and DECR name commands.
     */
    private Response handleStep(Command command, int step) {
        if (!parser.validateArgCount(command, 1)) {
            return Response.error(command.getType() + " requires name");
        }
        
        int shardIndex = counter.add(command.getArg(0), step);
        return Response.integer(shardIndex);
    }
    
    /**
     * Handles COUNT name command.
     */
    private Response handleCount(Command command) {
        if (!parser.validateArgCount(command, 1)) {
            return Response.error("COUNT requires name");
        }
        
        return Response.number(counter.count(command.getArg(0)));
    }
    
    /**
     * Handles ESTIMATE name [readFromShards [shards]] command.
     */
    private Response handleEstimate(Command command) {
        if (!parser.validateArgRange(command, 1, 3)) {
            return Response.error("ESTIMATE requires name and optional read-from-shards and shards");
        }
        
        Integer readFrom = parseOptionalInt(command.getArg(1), "read-from-shards");
        Integer shards = parseOptionalInt(command.getArg(2), "shard count");
        
        return Response.number(counter.estimateCount(command.getArg(0), shards, readFrom));
    }
    
    /**
     * Handles REBALANCE name [shards] command.
     */
    private Response handleRebalance(Command command) {
        if (!parser.validateArgRange(command, 1, 2)) {
            return Response.error("REBALANCE requires name and optional shards");
        }
        
        Integer shards = parseOptionalInt(command.getArg(1), "shard count");
        counter.rebalance(command.getArg(0), shards);
        return Response.ok();
    }
    
    /**
     * Handles RESET name command.
     */
    private Response handleReset(Command command) {
        if (!parser.validateArgCount(command, 1)) {
            return Response.error("RESET requires name");
        }
        
        counter.reset(command.getArg(0));
        return Response.ok();
    }
    
    /**
     * Handles STATS command.
     */
    private Response handleStats() {
        StatsCollector stats = counter.getStats();
        StringBuilder out = new StringBuilder();
        out.append("# Server Statistics");
        out.append("\r\n").append("total_connections:").append(totalConnections.get());
        out.append("\r\n").append("active_connections:").append(activeConnections.get());
        out.append("\r\n").append("total_commands:").append(totalCommands.get());
        out.append("\r\n").append("total_adds:").append(stats.getTotalAdds());
        out.append("\r\n").append("total_counts:").append(stats.getTotalCounts());
        out.append("\r\n").append("total_estimates:").append(stats.getTotalEstimates());
        out.append("\r\n").append("total_rebalances:").append(stats.getTotalRebalances());
        out.append("\r\n").append("total_resets:").append(stats.getTotalResets());
        out.append("\r\n").append("default_shard_count:").append(counter.getOptions().getDefaultShardCount());
        
        return Response.multiLine(out.toString());
    }
    
    private static Integer parseOptionalInt(String value, String what) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + what + " value");
        }
    }
    
    /**
     * Returns the command parser.
     */
    public CommandParser getParser() {
        return parser;
    }
}
