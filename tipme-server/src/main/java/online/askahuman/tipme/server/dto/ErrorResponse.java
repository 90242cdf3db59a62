package online.askahuman.tipme.server.dto;

/**
 * {@code {"error": "..."}} body of a failed {@code /api} request.
 */
public record ErrorResponse(String error) {}
