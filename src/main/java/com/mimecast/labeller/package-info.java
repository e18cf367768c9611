/**
 * The main package for Labeller, a mailbox label suggestion tool.
 *
 * <p>Labeller pages through a remote IMAP folder, asks an external classifier for label
 * <br>suggestions, stores them locally for review and applies the approved ones back to the mailbox.
 * <br>Every remote change is journalled first so a crash between the mailbox write and the local
 * <br>commit is repaired by reconciliation instead of being repeated blindly.
 *
 * <h2>CLI usage:</h2>
 * <pre>
 *      $ java -jar labeller.jar
 *      java -jar labeller.jar [options] &lt;command&gt; [args]
 *       Mailbox label suggestions with review and reconciliation
 *
 *      usage:   [-c &lt;arg&gt;] [--debug] [-h] [-p &lt;arg&gt;]
 *      -c,--config &lt;arg&gt;      Configuration file (default cfg/labeller.json5)
 *         --debug             Enable logging
 *      -h,--help              Show usage
 *      -p,--principal &lt;arg&gt;   Mailbox principal
 *
 *      Commands: classify, review, apply, reconcile, sessions, cleanup
 * </pre>
 *
 * <h2>Typical flow:</h2>
 * <pre>
 *      $ java -jar labeller.jar -p me@example.com classify --limit 500
 *      $ java -jar labeller.jar review 0b6f... --approve-above 0.9 --reject-below 0.3
 *      $ java -jar labeller.jar -p me@example.com apply 0b6f...
 *      $ java -jar labeller.jar -p me@example.com reconcile
 * </pre>
 */
package com.mimecast.labeller;
