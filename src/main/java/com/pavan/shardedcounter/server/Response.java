package com.pavan.shardedcounter.server;

/**
 * Represents a response to be sent to a client.
 */
public class Response {
    
    private final ResponseType type;
    private final String data;
    
    private static final String DELIMITER = "\r\n";
    
    private Response(ResponseType type, String data) {
        this.type = type;
        this.data = data;
    }
    
    /**
     * Creates a simple string response (e.g., +OK).
     */
    public static Response ok() {
        return new Response(ResponseType.SIMPLE_STRING, "OK");
    }
    
    /**
     * Creates a simple string response with custom message.
     */
    public static Response simpleString(String message) {
        return new Response(ResponseType.SIMPLE_STRING, message);
    }
    
    /**
     * Creates an error response.
     */
    public static Response error(String message) {
        return new Response(ResponseType.ERROR, message);
    }
    
    /**
     * Creates an integer response.
     */
    public static Response integer(long value) {
        return new Response(ResponseType.INTEGER, String.valueOf(value));
    }
    
    /**
     * Creates a floating-point response. Whole numbers are written without a fraction.
     */
    public static Response number(double value) {
        return new Response(ResponseType.DOUBLE, formatNumber(value));
    }
    
    /**
     * Creates a multi-line response.
     */
    public static Response multiLine(String content) {
        return new Response(ResponseType.MULTI_LINE, content);
    }
    
    static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
    
    /**
     * Serializes the response to the wire format.
     */
    public String serialize() {
        switch (type) {
            case SIMPLE_STRING:
                return "+" + data + DELIMITER;
            case ERROR:
                return "-ERR " + data + DELIMITER;
            case INTEGER:
                return ":" + data + DELIMITER;
            case DOUBLE:
                return "," + data + DELIMITER;
            case MULTI_LINE:
                return data + DELIMITER;
            default:
                return "-ERR Unknown response type" + DELIMITER;
        }
    }
    
    public ResponseType getType() {
        return type;
    }
    
    public String getData() {
        return data;
    }
    
    @Override
    public String toString() {
        return "Response{" +
                "type=" + type +
                ", data='" + data + '\'' +
                '}';
    }
    
    /**
     * Response types following the Redis protocol.
     */
    public enum ResponseType {
        SIMPLE_STRING,    // +OK
        ERROR,            // -ERR message
        INTEGER,          // :123
        DOUBLE,           // ,1.5
        MULTI_LINE        // Custom multi-line response
    }
}
