// file: server/src/main/java/io/inksync/server/dto/ErrorResponse.java
package io.inksync.server.dto;

public class ErrorResponse {
    public String error;

    public ErrorResponse() {
    }

    public ErrorResponse(String error) {
        this.error = error;
    }
}
