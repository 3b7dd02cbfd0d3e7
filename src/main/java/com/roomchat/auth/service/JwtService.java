package com.roomchat.auth.service;

import com.roomchat.auth.config.AuthProperties;
import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

/**
 * 身份令牌能力：网关与 REST 只消费 "校验 token，得到 userId"。
 *
 * <p>签发仅供本地联调与测试使用，正式的登录/凭证发放在本服务之外。</p>
 */
@Service
public class JwtService {

    public static final String CLAIM_USER_ID = "uid";
    public static final String CLAIM_TOKEN_TYPE = "typ";

    public static final String TOKEN_TYPE_ACCESS = "access";

    private final AuthProperties props;
    private final SecretKey key;

    public JwtService(AuthProperties props) {
        this.props = props;
        this.key = Keys.hmacShaKeyFor(props.jwtSecret().getBytes(StandardCharsets.UTF_8));
    }

    public String issueAccessToken(long userId) {
        Instant now = Instant.now();
        Instant exp = now.plusSeconds(props.accessTokenTtlSecondsEffective());

        return Jwts.builder()
                .issuer(props.issuer())
                .id(UUID.randomUUID().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(exp))
                .claims(Map.of(
                        CLAIM_USER_ID, userId,
                        CLAIM_TOKEN_TYPE, TOKEN_TYPE_ACCESS
                ))
                .signWith(key)
                .compact();
    }

    /**
     * 解析并校验 accessToken：签名、issuer、typ=access。
     */
    public Jws<Claims> parseAccessToken(String token) {
        JwtParser parser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(props.issuer())
                .build();

        Jws<Claims> jws = parser.parseSignedClaims(token);
        Claims claims = jws.getPayload();
        String typ = claims.get(CLAIM_TOKEN_TYPE, String.class);
        if (!TOKEN_TYPE_ACCESS.equals(typ)) {
            throw new JwtException("token_type_not_access");
        }
        return jws;
    }

    public long getUserId(Claims claims) {
        Number uid = claims.get(CLAIM_USER_ID, Number.class);
        if (uid == null || uid.longValue() <= 0) {
            throw new JwtException("missing_uid");
        }
        return uid.longValue();
    }

    /**
     * 校验 token 并直接返回 userId。
     */
    public long verify(String token) {
        return getUserId(parseAccessToken(token).getPayload());
    }
}
