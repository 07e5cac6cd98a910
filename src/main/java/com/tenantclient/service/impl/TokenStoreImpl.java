package com.tenantclient.service.impl;

import com.tenantclient.model.TokenPair;
import com.tenantclient.service.api.TokenStorage;
import com.tenantclient.service.api.TokenStore;
import org.springframework.stereotype.Service;

@Service
public class TokenStoreImpl implements TokenStore {

    static final String ACCESS_TOKEN_KEY = "access_token";
    static final String REFRESH_TOKEN_KEY = "refresh_token";

    private final TokenStorage storage;

    public TokenStoreImpl(TokenStorage storage) {
        this.storage = storage;
    }

    @Override
    public String getAccessToken() {
        return storage.read(ACCESS_TOKEN_KEY);
    }

    @Override
    public String getRefreshToken() {
        return storage.read(REFRESH_TOKEN_KEY);
    }

    @Override
    public void saveTokens(TokenPair tokens) {
        storage.write(ACCESS_TOKEN_KEY, tokens.accessToken());
        if (tokens.refreshToken() != null) {
            storage.write(REFRESH_TOKEN_KEY, tokens.refreshToken());
        } else {
            storage.remove(REFRESH_TOKEN_KEY);
        }
    }

    @Override
    public void saveAccessToken(String accessToken) {
        storage.write(ACCESS_TOKEN_KEY, accessToken);
    }

    @Override
    public void clear() {
        storage.remove(ACCESS_TOKEN_KEY, REFRESH_TOKEN_KEY);
    }
}
