package org.hypertrace.core.panelquery.opentsdb;

import java.util.Optional;

/** Supplies the value of the {@code Authorization} header sent to OpenTSDB, if any. */
public interface CredentialProvider {

  Optional<String> getAuthorization();
}
