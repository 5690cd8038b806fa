package kr.crownrpg.realtime.api.channel;

/**
 * Point-in-time view of a registry channel.
 *
 * @param generation identity of the channel instance; a channel re-created after closing gets a new one
 */
public record ChannelSnapshot(String topic, ChannelState state, int refCount, long generation) {
}
