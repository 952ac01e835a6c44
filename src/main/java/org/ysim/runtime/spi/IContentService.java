package org.ysim.runtime.spi;

import org.ysim.runtime.model.Actor;
import org.ysim.runtime.model.SlotTime;

import java.util.List;

/**
 * The remote content and graph service every action writes through.
 * <p>
 * Actor ids double as the service's user ids. All methods may be called concurrently from the
 * dispatcher's worker pools.
 */
public interface IContentService {

    /**
     * Registers an actor with the service.
     *
     * @param actor     the actor
     * @param joinedDay day the actor joins
     */
    void register(Actor actor, int joinedDay) throws GatewayException;

    /**
     * Clears all persisted state of the service.
     */
    void reset() throws GatewayException;

    /**
     * Moves the service clock to the given slot.
     */
    void updateTime(SlotTime time) throws GatewayException;

    /**
     * Publishes an original post.
     *
     * @return id of the new post
     */
    long publishPost(long actorId, String text, List<String> hashtags, List<String> mentions,
                     List<String> emotions, SlotTime time) throws GatewayException;

    /**
     * Publishes a news article post on behalf of a page.
     *
     * @return id of the new post
     */
    long publishArticle(long pageId, String title, String summary, String link, List<String> emotions,
                        SlotTime time) throws GatewayException;

    /**
     * Adds a comment below a post.
     *
     * @return id of the new comment
     */
    long comment(long actorId, long postId, String text, List<String> hashtags, List<String> mentions,
                 List<String> emotions, SlotTime time) throws GatewayException;

    /**
     * Shares a post with an accompanying text.
     *
     * @return id of the new share post
     */
    long share(long actorId, long postId, String text, List<String> emotions, SlotTime time)
            throws GatewayException;

    /**
     * Records a reaction ({@code "like"} or {@code "dislike"}) to a post.
     */
    void react(long actorId, long postId, String reaction, SlotTime time) throws GatewayException;

    /**
     * Records a voting preference expressed on a post.
     *
     * @param preference one of {@code "R"}, {@code "D"}, {@code "U"}
     */
    void castVote(long actorId, long postId, String preference, SlotTime time) throws GatewayException;

    void follow(long followerId, long followeeId, SlotTime time) throws GatewayException;

    void unfollow(long followerId, long followeeId, SlotTime time) throws GatewayException;

    /**
     * @return the text of a post
     */
    String getPostText(long postId) throws GatewayException;

    /**
     * Returns the conversation a post belongs to, oldest first, at most {@code maxLength} entries.
     */
    List<String> getThread(long postId, int maxLength) throws GatewayException;

    /**
     * @return id of the actor who wrote the post
     */
    long authorOf(long postId) throws GatewayException;

    /**
     * Adds the topics of the given posts to the actor's interests and returns the actor's
     * current interests within the attention window.
     */
    List<String> updateInterests(long actorId, List<Long> postIds, int attentionWindow, SlotTime time)
            throws GatewayException;

    /**
     * Marks an actor as having left the platform.
     */
    void churn(long actorId, SlotTime time) throws GatewayException;
}
