package com.mk.fx.qa.traffic.generator.executors;

import com.google.common.base.Throwables;
import com.mk.fx.qa.traffic.generator.model.ExceptionKind;
import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.BindException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.ProtocolException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.UnresolvedAddressException;
import java.util.List;
import javax.net.ssl.SSLException;

/**
 * Maps a transport failure to an {@link ExceptionKind}. The whole cause chain is searched, most
 * specific category first, because the transport wraps the JDK exception.
 */
final class OutcomeClassifier {

  private OutcomeClassifier() {
    throw new UnsupportedOperationException("OutcomeClassifier cannot be instantiated");
  }

  static ExceptionKind classify(Throwable failure) {
    if (failure == null) {
      return ExceptionKind.UNEXPECTED;
    }
    List<Throwable> chain = causalChain(failure);
    if (any(chain, HttpTimeoutException.class) || any(chain, SocketTimeoutException.class)) {
      return ExceptionKind.TIMEOUT;
    }
    if (any(chain, InterruptedException.class) || any(chain, ClosedByInterruptException.class)) {
      return ExceptionKind.INTERRUPTED;
    }
    // the JDK client reports a failed lookup as a ConnectException caused by the resolution error
    if (any(chain, UnknownHostException.class) || any(chain, UnresolvedAddressException.class)) {
      return ExceptionKind.UNKNOWN_HOST;
    }
    if (any(chain, ConnectException.class)) {
      return ExceptionKind.CONNECTION_REFUSED;
    }
    if (any(chain, SSLException.class)) {
      return ExceptionKind.SSL_ERROR;
    }
    if (any(chain, ProtocolException.class)) {
      return ExceptionKind.PROTOCOL_ERROR;
    }
    if (anyReset(chain)
        || any(chain, ClosedChannelException.class)
        || any(chain, EOFException.class)) {
      return ExceptionKind.CONNECTION_RESET;
    }
    if (any(chain, InterruptedIOException.class) || any(chain, IOException.class)) {
      return ExceptionKind.CONNECTION_ERROR;
    }
    return ExceptionKind.UNEXPECTED;
  }

  private static List<Throwable> causalChain(Throwable failure) {
    try {
      return Throwables.getCausalChain(failure);
    } catch (IllegalArgumentException loop) {
      // cause loop; the outer exception alone still classifies
      return List.of(failure);
    }
  }

  /** Plain socket failures; routing, binding and unreachable-port errors are not resets. */
  private static boolean anyReset(List<Throwable> chain) {
    for (Throwable t : chain) {
      if (t instanceof SocketException
          && !(t instanceof NoRouteToHostException
              || t instanceof BindException
              || t instanceof PortUnreachableException)) {
        return true;
      }
    }
    return false;
  }

  private static boolean any(List<Throwable> chain, Class<? extends Throwable> type) {
    for (Throwable t : chain) {
      if (type.isInstance(t)) {
        return true;
      }
    }
    return false;
  }
}
