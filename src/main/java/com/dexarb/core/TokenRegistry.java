package com.dexarb.core;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.Token;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class TokenRegistry {

    private final ConcurrentHashMap<String, Token> tokens = new ConcurrentHashMap<>();

    public TokenRegistry(ArbProperties properties) {
        for (ArbProperties.TokenProperties t : properties.getTokens()) {
            register(Token.of(t.getAddress(), t.getSymbol(), t.getDecimals()));
        }
        log.info("Token registry loaded with {} tokens", tokens.size());
    }

    public Token register(Token token) {
        tokens.put(token.getAddress(), token);
        return token;
    }

    public Optional<Token> find(String address) {
        if (address == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tokens.get(address.toLowerCase(Locale.ROOT)));
    }

    public Collection<Token> all() {
        return tokens.values();
    }
}
