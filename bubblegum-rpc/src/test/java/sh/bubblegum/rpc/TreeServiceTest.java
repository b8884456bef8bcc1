// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bubblegum.rpc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.bubblegum.core.ConnectionContext;
import sh.bubblegum.core.Outcome;
import sh.bubblegum.core.crypto.Credential;
import sh.bubblegum.core.error.BubblegumError;
import sh.bubblegum.core.error.TransactionBuildException;
import sh.bubblegum.core.model.TreeCreation;
import sh.bubblegum.core.types.Address;
import sh.bubblegum.core.types.TransactionEnvelope;
import sh.bubblegum.core.types.TransactionSignature;

@ExtendWith(MockitoExtension.class)
class TreeServiceTest {

    private static final TransactionEnvelope TX = TransactionEnvelope.of(new byte[] {4, 2});
    private static final Address TREE = new Address(TestKeys.TREE);

    @Mock
    private TransactionBuilder builder;

    @Mock
    private RpcClient rpc;

    private ConnectionContext context;
    private TreeService service;

    @BeforeEach
    void setUp() {
        context = new ConnectionContext();
        service = new TreeService(context, builder, rpc);
    }

    private static BubblegumError.RpcPayloadError payload(final String message) {
        return new BubblegumError.RpcPayloadError(-32002, message, JsonNodeFactory.instance.objectNode());
    }

    @Test
    void returnsTheBuilderTreeAddress() throws Exception {
        context.initialize(TestKeys.SECRET_KEY, "https://rpc.example.com");
        when(builder.buildCreateTree(any(Credential.class))).thenReturn(new TreeCreation(TX, TREE));
        when(rpc.submit(TX)).thenReturn(Outcome.ok(new TransactionSignature("sig")));

        Outcome<Address> outcome = service.createTree();

        assertEquals(TREE, outcome.orElseThrow());
    }

    @Test
    void passesTheConnectedCredentialToTheBuilder() throws Exception {
        context.initialize(TestKeys.SECRET_KEY, "https://rpc.example.com");
        when(builder.buildCreateTree(any(Credential.class))).thenAnswer(invocation -> {
            Credential credential = invocation.getArgument(0);
            assertEquals(TestKeys.OWNER, credential.address().value());
            return new TreeCreation(TX, TREE);
        });
        when(rpc.submit(TX)).thenReturn(Outcome.ok(new TransactionSignature("sig")));

        assertTrue(service.createTree().isOk());
    }

    @Test
    void notInitializedSkipsBuildAndSubmit() throws Exception {
        Outcome<Address> outcome = service.createTree();

        assertInstanceOf(BubblegumError.NotInitialized.class, outcome.errorOrNull());
        verify(builder, never()).buildCreateTree(any());
        verify(rpc, never()).submit(any());
    }

    @Test
    void builderFailureIsBuildFailed() throws Exception {
        context.initialize(TestKeys.SECRET_KEY, "https://rpc.example.com");
        TransactionBuildException cause = new TransactionBuildException("no tree config");
        when(builder.buildCreateTree(any(Credential.class))).thenThrow(cause);

        Outcome<Address> outcome = service.createTree();

        BubblegumError.BuildFailed failed = assertInstanceOf(BubblegumError.BuildFailed.class, outcome.errorOrNull());
        assertSame(cause, failed.cause());
        assertEquals("createTree", failed.operation());
        verify(rpc, never()).submit(any());
    }

    @Test
    void insufficientFundsIsClassified() throws Exception {
        context.initialize(TestKeys.SECRET_KEY, "https://rpc.example.com");
        when(builder.buildCreateTree(any(Credential.class))).thenReturn(new TreeCreation(TX, TREE));
        when(rpc.submit(TX)).thenReturn(Outcome.<TransactionSignature>err(payload("custom program error: 0x1"))
                .withContext("method", "sendTransaction"));

        Outcome<Address> outcome = service.createTree();

        assertInstanceOf(BubblegumError.InsufficientFunds.class, outcome.errorOrNull());
        Outcome.Err<Address> err = (Outcome.Err<Address>) outcome;
        assertEquals(TestKeys.TREE, err.context().get("treeAddress"));
        assertEquals("sendTransaction", err.context().get("method"));
    }

    @Test
    void expiredBlockhashIsClassified() throws Exception {
        context.initialize(TestKeys.SECRET_KEY, "https://rpc.example.com");
        when(builder.buildCreateTree(any(Credential.class))).thenReturn(new TreeCreation(TX, TREE));
        when(rpc.submit(TX)).thenReturn(Outcome.err(payload("Blockhash not found")));

        assertInstanceOf(BubblegumError.ExpiredBlockhash.class, service.createTree().errorOrNull());
    }

    @Test
    void networkFailureIsUnknownSubmitFailure() throws Exception {
        context.initialize(TestKeys.SECRET_KEY, "https://rpc.example.com");
        when(builder.buildCreateTree(any(Credential.class))).thenReturn(new TreeCreation(TX, TREE));
        BubblegumError.NetworkError network = new BubblegumError.NetworkError(new IOException("refused"));
        when(rpc.submit(TX)).thenReturn(Outcome.err(network));

        BubblegumError.UnknownSubmitFailure unknown =
                assertInstanceOf(BubblegumError.UnknownSubmitFailure.class, service.createTree().errorOrNull());
        assertSame(network, unknown.cause());
    }
}
