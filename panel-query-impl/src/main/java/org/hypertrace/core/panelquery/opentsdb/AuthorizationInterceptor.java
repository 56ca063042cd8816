package org.hypertrace.core.panelquery.opentsdb;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

public class AuthorizationInterceptor implements Interceptor {
  private static final String AUTHORIZATION_HEADER = "Authorization";

  private final CredentialProvider credentialProvider;

  public AuthorizationInterceptor(CredentialProvider credentialProvider) {
    this.credentialProvider = credentialProvider;
  }

  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    return chain.proceed(
        credentialProvider
            .getAuthorization()
            .map(value -> request.newBuilder().header(AUTHORIZATION_HEADER, value).build())
            .orElse(request));
  }
}
