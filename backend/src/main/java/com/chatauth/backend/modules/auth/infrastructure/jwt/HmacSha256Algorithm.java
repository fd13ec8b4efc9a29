package com.chatauth.backend.modules.auth.infrastructure.jwt;

import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;

import javax.crypto.Mac;
import javax.crypto.SecretKey;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;
import io.jsonwebtoken.security.SecretKeyBuilder;
import io.jsonwebtoken.security.SecureRequest;
import io.jsonwebtoken.security.SignatureException;
import io.jsonwebtoken.security.VerifySecureDigestRequest;

/**
 * HS256 without jjwt's 256-bit minimum key length. Used only for secrets shorter than
 * that, so tokens signed by existing deployments with such secrets keep verifying.
 * Output is byte-identical to {@link Jwts.SIG#HS256} for the same key.
 */
public final class HmacSha256Algorithm implements MacAlgorithm {

    public static final HmacSha256Algorithm INSTANCE = new HmacSha256Algorithm();

    private static final String JCA_NAME = "HmacSHA256";
    private static final int BUFFER_SIZE = 4096;

    private HmacSha256Algorithm() {
    }

    @Override
    public String getId() {
        return Jwts.SIG.HS256.getId();
    }

    @Override
    public int getKeyBitLength() {
        return Jwts.SIG.HS256.getKeyBitLength();
    }

    @Override
    public SecretKeyBuilder key() {
        return Jwts.SIG.HS256.key();
    }

    @Override
    public byte[] digest(SecureRequest<InputStream, SecretKey> request) {
        try {
            Mac mac = Mac.getInstance(JCA_NAME);
            mac.init(request.getKey());
            InputStream payload = request.getPayload();
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = payload.read(buffer)) != -1) {
                mac.update(buffer, 0, read);
            }
            return mac.doFinal();
        } catch (GeneralSecurityException | IOException e) {
            throw new SignatureException("HMAC-SHA256 computation failed", e);
        }
    }

    @Override
    public boolean verify(VerifySecureDigestRequest<SecretKey> request) {
        return MessageDigest.isEqual(digest(request), request.getDigest());
    }
}
