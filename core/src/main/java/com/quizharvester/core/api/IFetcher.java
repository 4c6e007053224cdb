// IFetcher.java
package com.quizharvester.core.api;

import com.quizharvester.core.http.FetchRequest;
import com.quizharvester.core.http.FetchResult;

import java.io.IOException;

/** 페처 최소 계약: 요청을 받아 (캐시 또는 네트워크) 응답 내용을 돌려준다. */
public interface IFetcher extends AutoCloseable {
    FetchResult fetch(FetchRequest request) throws IOException, InterruptedException;
    @Override default void close() throws Exception {}
}
