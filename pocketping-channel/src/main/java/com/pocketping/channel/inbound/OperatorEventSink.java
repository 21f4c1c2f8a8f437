package com.pocketping.channel.inbound;

/**
 * Receiver of operator actions coming from platform webhooks or the Discord
 * gateway. Implementations must not throw back into the transport.
 */
public interface OperatorEventSink {

    void onOperatorMessage(OperatorEvents.OperatorMessage message);

    void onOperatorMessageEdited(OperatorEvents.OperatorEdit edit);

    void onOperatorMessageDeleted(OperatorEvents.OperatorDelete delete);
}
