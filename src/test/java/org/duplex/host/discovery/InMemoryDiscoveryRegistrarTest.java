package org.duplex.host.discovery;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class InMemoryDiscoveryRegistrarTest {

    private final InMemoryDiscoveryRegistrar registrar = new InMemoryDiscoveryRegistrar();

    @Test
    void register_keepsSubmissionOrderAndFiltersByProtocol() throws Exception {
        final Node fooRpc = new Node("10.0.0.7", 50051, Protocol.RPC, "Foo");
        final Node fooHttp = new Node("10.0.0.7", 8080, Protocol.HTTP, "Foo");
        final Node barRpc = new Node("10.0.0.7", 50051, Protocol.RPC, "Bar");

        registrar.register(fooRpc);
        registrar.register(fooHttp);
        registrar.register(barRpc);

        assertThat(registrar.getNodes()).containsExactly(fooRpc, fooHttp, barRpc);
        assertThat(registrar.getNodes(Protocol.RPC)).containsExactly(fooRpc, barRpc);
        assertThat(registrar.getNodes(Protocol.HTTP)).containsExactly(fooHttp);
        assertThat(registrar.lookup("Foo")).containsExactly(fooRpc, fooHttp);
        assertThat(registrar.lookup("Baz")).isEmpty();
    }

    @Test
    void register_nullNode_isRejected() {
        assertThatThrownBy(() -> registrar.register(null))
            .isInstanceOf(DiscoveryException.class);
        assertThat(registrar.getNodes()).isEmpty();
    }

    @Test
    void clear_removesAllNodes() throws Exception {
        registrar.register(new Node("h", 1, Protocol.RPC, "Foo"));
        final List<Node> snapshot = registrar.getNodes();

        registrar.clear();

        assertThat(registrar.getNodes()).isEmpty();
        assertThat(snapshot).hasSize(1);
    }

    @Test
    void register_concurrentSubmissions_areAllStored() throws Exception {
        final ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            final List<Callable<Void>> tasks = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                final int port = 1000 + i;
                tasks.add(() -> {
                    registrar.register(new Node("h", port, protocolFor(port), "Svc"));
                    return null;
                });
            }
            for (final Future<Void> future : pool.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            pool.shutdown();
            pool.awaitTermination(5, TimeUnit.SECONDS);
        }

        assertThat(registrar.getNodes()).hasSize(100);
        assertThat(registrar.getNodes(Protocol.RPC)).hasSize(50);
    }

    private static Protocol protocolFor(final int port) {
        return port % 2 == 0 ? Protocol.RPC : Protocol.HTTP;
    }
}
