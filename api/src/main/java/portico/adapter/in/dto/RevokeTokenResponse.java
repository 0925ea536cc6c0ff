package portico.adapter.in.dto;

public record RevokeTokenResponse(String jti, String status, String expiresAt) {}
